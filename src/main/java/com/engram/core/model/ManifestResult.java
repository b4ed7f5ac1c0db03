package com.engram.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partial result of interpreting one manifest file.
 *
 * @param packageManager         ecosystem tag, empty when the manifest could not be interpreted
 * @param description            project description declared by the manifest, or empty
 * @param dependenciesByCategory category (e.g. {@code dependencies}, {@code crates}) to dependency names
 * @param frameworks             framework labels in detection order, without duplicates
 */
public record ManifestResult(
    String packageManager,
    String description,
    Map<String, List<String>> dependenciesByCategory,
    List<String> frameworks
) {

    public ManifestResult {
        packageManager = packageManager == null ? "" : packageManager;
        description = description == null ? "" : description;
        var deps = new LinkedHashMap<String, List<String>>();
        dependenciesByCategory.forEach((category, names) -> deps.put(category, List.copyOf(names)));
        dependenciesByCategory = Collections.unmodifiableMap(deps);
        frameworks = List.copyOf(frameworks);
    }

    public static ManifestResult empty() {
        return new ManifestResult("", "", Map.of(), List.of());
    }

    public boolean isEmpty() {
        return packageManager.isEmpty() && description.isEmpty()
                && dependenciesByCategory.isEmpty() && frameworks.isEmpty();
    }
}
