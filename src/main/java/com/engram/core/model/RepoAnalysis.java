package com.engram.core.model;

import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of one heuristic repository analysis.
 * <p>
 * Built once per run by {@link com.engram.core.engine.RepoAnalyzer}; every collection is
 * unmodifiable and keeps the insertion order the analysis produced, so two runs over an
 * unchanged directory yield equal records.
 */
public record RepoAnalysis(
    String path,
    String name,
    String description,

    // Structure
    int totalFiles,
    int totalDirs,
    Map<String, Integer> topDirs,
    Map<String, Integer> fileExtensions,

    // Languages & ecosystems
    Map<String, Double> languages,
    List<String> frameworks,
    List<String> packageManagers,
    Map<String, List<String>> dependencies,

    // Testing
    boolean hasTests,
    String testFramework,
    List<String> testDirs,
    int testFileCount,

    // CI/CD
    boolean hasCi,
    String ciPlatform,
    List<String> ciFiles,

    // Infrastructure
    boolean hasDocker,
    List<String> dockerFiles,
    boolean hasK8s,

    // Documentation
    boolean hasReadme,
    String readmeExcerpt,
    boolean hasContributing,
    boolean hasChangelog,
    boolean hasLicense,
    String licenseType,

    // Version control
    List<CommitInfo> recentCommits,
    List<Contributor> contributors,
    int commitCount,
    String firstCommitDate,
    String lastCommitDate,

    // Structure-derived
    List<String> patterns,
    List<String> entryPoints,
    List<String> configFiles,
    Map<String, String> keyFileContents,

    List<String> warnings
) {}
