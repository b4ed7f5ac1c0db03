package com.engram.core.engine;

import com.engram.core.model.CommitInfo;
import com.engram.core.model.Contributor;
import com.engram.core.model.HistorySummary;
import com.engram.core.model.ManifestResult;
import com.engram.core.model.RepoAnalysis;
import com.engram.core.scanner.TreeSummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Merges the partial results of one analysis.
 * <p>
 * Scalars are first-writer-wins, labeled sets are unioned in first-seen order and logs
 * (commits, warnings) are appended. Owned by a single {@link RepoAnalyzer#analyze} call.
 */
final class AnalysisAccumulator {

    private String description = "";

    private TreeSummary tree;
    private int topDirLimit;
    private int topExtensionLimit;

    private Map<String, Double> languages = Map.of();
    private final LinkedHashSet<String> frameworks = new LinkedHashSet<>();
    private final LinkedHashSet<String> packageManagers = new LinkedHashSet<>();
    private final Map<String, LinkedHashSet<String>> dependencies = new LinkedHashMap<>();

    private String licenseType = "";
    private final LinkedHashSet<String> patterns = new LinkedHashSet<>();

    private String readmeExcerpt = "";
    private final Map<String, String> keyFileContents = new LinkedHashMap<>();

    private final List<CommitInfo> recentCommits = new ArrayList<>();
    private final List<Contributor> contributors = new ArrayList<>();
    private int commitCount;
    private String firstCommitDate = "";
    private String lastCommitDate = "";

    private final List<String> warnings = new ArrayList<>();

    void applyTree(TreeSummary summary, int topDirLimit, int topExtensionLimit) {
        this.tree = summary;
        this.topDirLimit = topDirLimit;
        this.topExtensionLimit = topExtensionLimit;
        warnings.addAll(summary.warnings());
    }

    TreeSummary tree() {
        return tree;
    }

    void setLanguages(Map<String, Double> languages) {
        if (this.languages.isEmpty()) {
            this.languages = languages;
        }
    }

    void addManifest(ManifestResult result) {
        if (result.isEmpty()) {
            return;
        }
        offerDescription(result.description());
        if (!result.packageManager().isEmpty()) {
            packageManagers.add(result.packageManager());
        }
        frameworks.addAll(result.frameworks());
        result.dependenciesByCategory().forEach((category, names) ->
                dependencies.computeIfAbsent(category, k -> new LinkedHashSet<>()).addAll(names));
    }

    void offerDescription(String candidate) {
        if (description.isEmpty() && candidate != null && !candidate.isEmpty()) {
            description = candidate;
        }
    }

    String description() {
        return description;
    }

    List<String> frameworks() {
        return List.copyOf(frameworks);
    }

    void setLicenseType(String licenseType) {
        if (this.licenseType.isEmpty()) {
            this.licenseType = licenseType;
        }
    }

    void addPatterns(List<String> detected) {
        patterns.addAll(detected);
    }

    void putKeyFile(String fileName, String content) {
        keyFileContents.putIfAbsent(fileName, content);
    }

    void setReadmeExcerpt(String excerpt) {
        if (readmeExcerpt.isEmpty()) {
            readmeExcerpt = excerpt;
        }
    }

    void applyHistory(HistorySummary history) {
        recentCommits.addAll(history.recentCommits());
        contributors.addAll(history.contributors());
        if (commitCount == 0) {
            commitCount = history.commitCount();
        }
        if (firstCommitDate.isEmpty()) {
            firstCommitDate = history.firstCommitDate();
        }
        if (lastCommitDate.isEmpty()) {
            lastCommitDate = history.lastCommitDate();
        }
        warnings.addAll(history.warnings());
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }

    void addWarnings(List<String> more) {
        warnings.addAll(more);
    }

    int warningCount() {
        return warnings.size();
    }

    RepoAnalysis build(String path, String name) {
        TreeSummary t = tree != null ? tree : emptyTree();
        var deps = new LinkedHashMap<String, List<String>>();
        dependencies.forEach((category, names) -> deps.put(category, List.copyOf(names)));

        return new RepoAnalysis(
                path,
                name,
                description,
                t.totalFiles(),
                t.totalDirs(),
                t.topDirs(topDirLimit),
                t.topExtensions(topExtensionLimit),
                Collections.unmodifiableMap(new LinkedHashMap<>(languages)),
                List.copyOf(frameworks),
                List.copyOf(packageManagers),
                Collections.unmodifiableMap(deps),
                t.hasTests(),
                t.testFramework(),
                t.testDirs(),
                t.testFileCount(),
                t.hasCi(),
                t.ciPlatform(),
                t.ciFiles(),
                t.hasDocker(),
                t.dockerFiles(),
                t.hasK8s(),
                t.hasReadme(),
                readmeExcerpt,
                t.hasContributing(),
                t.hasChangelog(),
                t.hasLicense(),
                licenseType,
                List.copyOf(recentCommits),
                List.copyOf(contributors),
                commitCount,
                firstCommitDate,
                lastCommitDate,
                List.copyOf(patterns),
                t.entryPoints(),
                t.configFiles(),
                Collections.unmodifiableMap(new LinkedHashMap<>(keyFileContents)),
                List.copyOf(warnings));
    }

    private static TreeSummary emptyTree() {
        return new TreeSummary(0, 0, Map.of(), Map.of(), false, "", List.of(), 0,
                false, "", List.of(), false, List.of(), false,
                false, false, false, false, List.of(), List.of(), false, List.of());
    }
}
