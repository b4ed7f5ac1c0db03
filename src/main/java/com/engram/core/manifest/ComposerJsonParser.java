package com.engram.core.manifest;

import com.engram.core.model.ManifestResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * PHP {@code composer.json}: {@code require} and {@code require-dev} packages.
 * Platform requirements ({@code php}, {@code php-*}, {@code ext-*}) are not dependencies.
 */
public class ComposerJsonParser implements ManifestParser {

    static final String PACKAGE_MANAGER = "Composer";
    static final String CATEGORY = "composer";
    private static final int MAX_DEPENDENCIES = 20;

    private static final Map<String, String> FRAMEWORKS = Map.of(
            "laravel/framework", "Laravel",
            "symfony/framework-bundle", "Symfony",
            "slim/slim", "Slim",
            "phpunit/phpunit", "PHPUnit"
    );

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public ManifestResult parse(String content) throws IOException {
        JsonNode root = MAPPER.readTree(content);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("composer.json root is not a JSON object");
        }

        var names = new ArrayList<String>();
        for (String group : List.of("require", "require-dev")) {
            JsonNode deps = root.get(group);
            if (deps != null && deps.isObject()) {
                deps.fieldNames().forEachRemaining(names::add);
            }
        }

        var frameworks = new ArrayList<String>();
        var packages = new ArrayList<String>();
        for (String name : names) {
            String label = FRAMEWORKS.get(name);
            if (label != null) {
                FrameworkRule.addLabel(frameworks, label);
            }
            if (!isPlatformRequirement(name)) {
                packages.add(name);
            }
        }

        JsonNode description = root.get("description");
        String text = description != null && description.isTextual() ? description.asText() : "";
        Map<String, List<String>> dependencies = packages.isEmpty()
                ? Map.of()
                : Map.of(CATEGORY, FrameworkRule.firstN(packages, MAX_DEPENDENCIES));
        return new ManifestResult(PACKAGE_MANAGER, text, dependencies, frameworks);
    }

    private static boolean isPlatformRequirement(String name) {
        return name.equals("php") || name.startsWith("php-") || name.startsWith("ext-");
    }
}
