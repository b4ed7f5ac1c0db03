package com.engram.core.manifest;

import java.util.LinkedHashSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maven {@code pom.xml}. Each {@code <dependency>} element contributes its
 * {@code groupId:artifactId}; plugins and parent coordinates are not dependencies.
 */
public class MavenPomParser extends JvmBuildParser {

    static final String CATEGORY = "maven";

    private static final Pattern DEPENDENCY = Pattern.compile("<dependency>(.*?)</dependency>", Pattern.DOTALL);
    private static final Pattern GROUP_ID = Pattern.compile("<groupId>\\s*([^<\\s]+)\\s*</groupId>");
    private static final Pattern ARTIFACT_ID = Pattern.compile("<artifactId>\\s*([^<\\s]+)\\s*</artifactId>");

    @Override
    protected String category() {
        return CATEGORY;
    }

    @Override
    protected LinkedHashSet<String> dependencyCoordinates(String content) {
        var coordinates = new LinkedHashSet<String>();
        Matcher dependency = DEPENDENCY.matcher(content);
        while (dependency.find()) {
            String body = dependency.group(1);
            Matcher group = GROUP_ID.matcher(body);
            Matcher artifact = ARTIFACT_ID.matcher(body);
            if (group.find() && artifact.find()) {
                coordinates.add(group.group(1) + ":" + artifact.group(1));
            }
        }
        return coordinates;
    }
}
