package com.engram.core.engine;

import com.engram.core.model.Contributor;
import com.engram.core.model.RepoAnalysis;
import com.engram.core.scanner.TreeSummary;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a {@link RepoAnalysis} as a compact, line-per-fact text block.
 * <p>
 * Lines appear in a fixed order and are omitted when their facts are empty, so the output
 * is stable for a given record.
 */
public final class AnalysisSummary {

    static final int MAX_LANGUAGES = 8;
    static final int MAX_DIRS = 12;
    static final int MAX_DEPENDENCIES = 15;
    static final int MAX_CONTRIBUTORS = 8;

    private AnalysisSummary() {}

    public static String render(RepoAnalysis a) {
        var lines = new ArrayList<String>();
        lines.add("Repository: " + a.name());
        if (!a.description().isEmpty()) {
            lines.add("Description: " + a.description());
        }
        lines.add("Files: " + a.totalFiles() + ", Directories: " + a.totalDirs());

        if (!a.languages().isEmpty()) {
            lines.add("Languages: " + a.languages().entrySet().stream()
                    .limit(MAX_LANGUAGES)
                    .map(e -> String.format(Locale.ROOT, "%s (%.0f%%)", e.getKey(), e.getValue()))
                    .collect(Collectors.joining(", ")));
        }
        if (!a.frameworks().isEmpty()) {
            lines.add("Frameworks: " + String.join(", ", a.frameworks()));
        }
        if (!a.topDirs().isEmpty()) {
            lines.add("Top directories: " + TreeSummary.mostCommon(a.topDirs(), MAX_DIRS).entrySet().stream()
                    .map(e -> e.getKey() + "/ (" + e.getValue() + " files)")
                    .collect(Collectors.joining(", ")));
        }
        for (Map.Entry<String, List<String>> deps : a.dependencies().entrySet()) {
            if (!deps.getValue().isEmpty()) {
                List<String> shown = deps.getValue().subList(0, Math.min(MAX_DEPENDENCIES, deps.getValue().size()));
                lines.add(deps.getKey() + " deps: " + String.join(", ", shown));
            }
        }

        if (a.hasTests()) {
            String framework = a.testFramework().isEmpty() ? "detected" : a.testFramework();
            String dirs = a.testDirs().isEmpty() ? "various dirs" : String.join(", ", a.testDirs());
            lines.add("Testing: " + framework + ", " + a.testFileCount() + " test files in " + dirs);
        }
        if (a.hasCi()) {
            lines.add("CI/CD: " + a.ciPlatform() + ", files: " + String.join(", ", a.ciFiles()));
        }
        if (a.hasDocker()) {
            lines.add("Docker: " + String.join(", ", a.dockerFiles()));
        }
        if (a.hasK8s()) {
            lines.add("Kubernetes: manifests detected");
        }
        if (!a.licenseType().isEmpty()) {
            lines.add("License: " + a.licenseType());
        }

        if (!a.patterns().isEmpty()) {
            lines.add("Patterns: " + String.join(", ", a.patterns()));
        }
        if (!a.entryPoints().isEmpty()) {
            lines.add("Entry points: " + String.join(", ", a.entryPoints()));
        }
        if (!a.configFiles().isEmpty()) {
            lines.add("Config files: " + String.join(", ", a.configFiles()));
        }

        if (a.commitCount() > 0) {
            lines.add("Commits: " + a.commitCount() + ", active " + a.firstCommitDate() + " to " + a.lastCommitDate());
        }
        if (!a.contributors().isEmpty()) {
            lines.add("Contributors: " + a.contributors().stream()
                    .limit(MAX_CONTRIBUTORS)
                    .map(AnalysisSummary::contributor)
                    .collect(Collectors.joining(", ")));
        }
        return String.join("\n", lines);
    }

    private static String contributor(Contributor c) {
        return c.name() + " (" + c.commits() + ")";
    }
}
