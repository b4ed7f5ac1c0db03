package com.engram.core.scanner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a single pass over a repository tree.
 * <p>
 * {@code topLevelDirs} and {@code extensionCounts} hold complete, first-seen ordered
 * counts; use {@link #topDirs(int)} and {@link #topExtensions(int)} for the bounded views.
 */
public record TreeSummary(
    int totalFiles,
    int totalDirs,
    Map<String, Integer> topLevelDirs,
    Map<String, Integer> extensionCounts,
    boolean hasTests,
    String testFramework,
    List<String> testDirs,
    int testFileCount,
    boolean hasCi,
    String ciPlatform,
    List<String> ciFiles,
    boolean hasDocker,
    List<String> dockerFiles,
    boolean hasK8s,
    boolean hasReadme,
    boolean hasContributing,
    boolean hasChangelog,
    boolean hasLicense,
    List<String> configFiles,
    List<String> entryPoints,
    boolean truncated,
    List<String> warnings
) {

    public TreeSummary {
        topLevelDirs = Collections.unmodifiableMap(new LinkedHashMap<>(topLevelDirs));
        extensionCounts = Collections.unmodifiableMap(new LinkedHashMap<>(extensionCounts));
        testDirs = List.copyOf(testDirs);
        ciFiles = List.copyOf(ciFiles);
        dockerFiles = List.copyOf(dockerFiles);
        configFiles = List.copyOf(configFiles);
        entryPoints = List.copyOf(entryPoints);
        warnings = List.copyOf(warnings);
    }

    public Map<String, Integer> topDirs(int limit) {
        return mostCommon(topLevelDirs, limit);
    }

    public Map<String, Integer> topExtensions(int limit) {
        return mostCommon(extensionCounts, limit);
    }

    /**
     * Returns the {@code limit} highest counts in descending order. Equal counts keep
     * their original (first-seen) order.
     */
    public static Map<String, Integer> mostCommon(Map<String, Integer> counts, int limit) {
        var entries = new ArrayList<>(counts.entrySet());
        // List.sort is stable, so ties keep insertion order
        entries.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
        var result = new LinkedHashMap<String, Integer>();
        for (var entry : entries.subList(0, Math.min(limit, entries.size()))) {
            result.put(entry.getKey(), entry.getValue());
        }
        return Collections.unmodifiableMap(result);
    }
}
