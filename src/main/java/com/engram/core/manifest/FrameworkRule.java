package com.engram.core.manifest;

import java.util.Collection;
import java.util.List;

/**
 * A static dependency-key to framework-label mapping entry.
 */
record FrameworkRule(String key, String label) {

    static void addLabel(Collection<String> frameworks, String label) {
        if (!frameworks.contains(label)) {
            frameworks.add(label);
        }
    }

    static List<String> firstN(List<String> names, int limit) {
        return names.size() <= limit ? names : names.subList(0, limit);
    }
}
