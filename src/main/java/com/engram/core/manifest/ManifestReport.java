package com.engram.core.manifest;

import com.engram.core.model.ManifestResult;

import java.util.List;

/**
 * Results of all manifests found at a repository root, in {@link ManifestKind} order,
 * plus one warning per manifest that could not be read or parsed.
 */
public record ManifestReport(List<ManifestResult> results, List<String> warnings) {

    public ManifestReport {
        results = List.copyOf(results);
        warnings = List.copyOf(warnings);
    }
}
