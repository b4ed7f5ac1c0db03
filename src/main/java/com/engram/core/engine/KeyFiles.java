package com.engram.core.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Capped contents of the key files present at a repository root.
 *
 * @param contents      file name to content, in {@link KeyFileReader#KEY_FILES} order
 * @param readmeExcerpt head of {@code README.md}, or empty
 * @param warnings      one entry per key file that exists but could not be read
 */
public record KeyFiles(Map<String, String> contents, String readmeExcerpt, List<String> warnings) {

    public KeyFiles {
        contents = Collections.unmodifiableMap(new LinkedHashMap<>(contents));
        warnings = List.copyOf(warnings);
    }
}
