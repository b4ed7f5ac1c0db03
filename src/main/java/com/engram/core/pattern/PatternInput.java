package com.engram.core.pattern;

import java.util.List;
import java.util.Set;

/**
 * Structural facts the pattern rules look at.
 *
 * @param topLevelDirs    names of all top-level directories
 * @param frameworks      framework labels detected so far
 * @param extensions      every file extension seen (lower-cased, with dot)
 * @param description     project description, may be empty
 * @param configFileNames base names of recognized config files
 */
public record PatternInput(
    Set<String> topLevelDirs,
    List<String> frameworks,
    Set<String> extensions,
    String description,
    Set<String> configFileNames
) {

    public PatternInput {
        topLevelDirs = Set.copyOf(topLevelDirs);
        frameworks = List.copyOf(frameworks);
        extensions = Set.copyOf(extensions);
        description = description == null ? "" : description;
        configFileNames = Set.copyOf(configFileNames);
    }

    boolean hasDir(String name) {
        return topLevelDirs.contains(name);
    }

    boolean hasAnyDir(String... names) {
        for (String name : names) {
            if (topLevelDirs.contains(name)) {
                return true;
            }
        }
        return false;
    }

    boolean hasAllDirs(String... names) {
        for (String name : names) {
            if (!topLevelDirs.contains(name)) {
                return false;
            }
        }
        return true;
    }
}
