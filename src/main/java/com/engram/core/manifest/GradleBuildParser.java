package com.engram.core.manifest;

import java.util.LinkedHashSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Gradle {@code build.gradle} and {@code build.gradle.kts}. String-notation
 * coordinates passed to a dependency configuration, e.g.
 * {@code implementation("group:artifact:version")}, are reported as {@code group:artifact}.
 */
public class GradleBuildParser extends JvmBuildParser {

    static final String CATEGORY = "gradle";

    private static final Pattern CONFIGURATION_CALL = Pattern.compile(
            "\\b(?:implementation|api|compileOnly|runtimeOnly|testImplementation|testRuntimeOnly"
                    + "|testCompileOnly|annotationProcessor|kapt|compile|testCompile)"
                    + "\\s*\\(?\\s*[\"']([^\"':\\s]+):([^\"':\\s]+)(?::[^\"']*)?[\"']");

    @Override
    protected String category() {
        return CATEGORY;
    }

    @Override
    protected LinkedHashSet<String> dependencyCoordinates(String content) {
        var coordinates = new LinkedHashSet<String>();
        Matcher call = CONFIGURATION_CALL.matcher(content);
        while (call.find()) {
            coordinates.add(call.group(1) + ":" + call.group(2));
        }
        return coordinates;
    }
}
