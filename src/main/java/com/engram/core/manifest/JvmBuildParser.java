package com.engram.core.manifest;

import com.engram.core.model.ManifestResult;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shared framework detection for Maven and Gradle build files. Subclasses only
 * extract dependency coordinates in their own syntax.
 */
abstract class JvmBuildParser implements ManifestParser {

    static final String PACKAGE_MANAGER = "Maven/Gradle";
    private static final int MAX_DEPENDENCIES = 20;

    /** Matched as case-insensitive substrings of the whole build file. */
    private static final List<FrameworkRule> FRAMEWORKS = List.of(
            new FrameworkRule("spring-boot", "Spring Boot"),
            new FrameworkRule("spring-framework", "Spring"),
            new FrameworkRule("quarkus", "Quarkus"),
            new FrameworkRule("micronaut", "Micronaut"),
            new FrameworkRule("junit", "JUnit"),
            new FrameworkRule("mockito", "Mockito"),
            new FrameworkRule("vertx", "Vert.x"),
            new FrameworkRule("dropwizard", "Dropwizard"),
            new FrameworkRule("ktor", "Ktor")
    );

    @Override
    public ManifestResult parse(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        var frameworks = new ArrayList<String>();
        for (var rule : FRAMEWORKS) {
            if (lower.contains(rule.key())) {
                FrameworkRule.addLabel(frameworks, rule.label());
            }
        }

        var coordinates = new ArrayList<>(dependencyCoordinates(content));
        Map<String, List<String>> dependencies = coordinates.isEmpty()
                ? Map.of()
                : Map.of(category(), FrameworkRule.firstN(coordinates, MAX_DEPENDENCIES));
        return new ManifestResult(PACKAGE_MANAGER, "", dependencies, frameworks);
    }

    /** Dependency category name for this build tool. */
    protected abstract String category();

    /**
     * @return {@code group:artifact} names in declaration order, without duplicates
     */
    protected abstract LinkedHashSet<String> dependencyCoordinates(String content);
}
