package com.engram.core.scanner;

import com.engram.core.engine.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Walks a repository once and classifies every file against the {@link WalkRules}
 * tables in the same pass.
 * <p>
 * Ignored directories (e.g. {@code .git}, {@code node_modules}, {@code target}) are pruned
 * before descent, so vendored trees cost nothing beyond their directory entry. Entries are
 * visited in name order, files before subdirectories, which makes the result independent
 * of the file system's listing order.
 */
@Service
public class TreeWalker {

    private static final Logger log = LoggerFactory.getLogger(TreeWalker.class);

    /**
     * Walks the tree under {@code root} and returns its {@link TreeSummary}.
     * Never throws for unreadable subdirectories; they are skipped and reported as warnings.
     *
     * @param root     the repository root, must be an existing directory
     * @param deadline time budget; when it expires, descent stops and the summary is marked truncated
     * @return summary of the pruned tree
     */
    public TreeSummary walk(Path root, Deadline deadline) {
        var state = new WalkState();
        Deque<Path> pending = new ArrayDeque<>();
        pending.push(root);

        while (!pending.isEmpty()) {
            if (deadline.isExpired()) {
                log.warn("Deadline reached while walking {}; {} directories left unvisited", root, pending.size());
                state.truncated = true;
                state.warnings.add("walk: deadline reached, " + pending.size() + " directories not visited");
                break;
            }

            Path dir = pending.pop();
            if (!dir.equals(root)) {
                state.totalDirs++;
                if (dir.getParent().equals(root)) {
                    state.topLevelDirs.putIfAbsent(dir.getFileName().toString(), 0);
                }
            }

            List<Path> subdirs = new ArrayList<>();
            for (Path entry : listSorted(root, dir, state)) {
                String name = entry.getFileName().toString();
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    if (!WalkRules.isIgnoredDirectory(name)) {
                        subdirs.add(entry);
                    }
                } else if (Files.isRegularFile(entry)) {
                    visitFile(root, entry, state);
                }
            }
            // Push in reverse so subdirectories are popped in name order
            for (int i = subdirs.size() - 1; i >= 0; i--) {
                pending.push(subdirs.get(i));
            }
        }

        log.debug("Walked {}: {} files, {} directories", root, state.totalFiles, state.totalDirs);
        return state.toSummary();
    }

    private List<Path> listSorted(Path root, Path dir, WalkState state) {
        var entries = new ArrayList<Path>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                entries.add(entry);
            }
        } catch (IOException | SecurityException e) {
            log.debug("Cannot list directory {}: {}", dir, e.getMessage());
            state.warnings.add("walk: cannot list " + relativize(root, dir) + ": " + e.getMessage());
            return List.of();
        }
        entries.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return entries;
    }

    private void visitFile(Path root, Path file, WalkState state) {
        String name = file.getFileName().toString();
        String extension = WalkRules.extensionOf(name);
        if (WalkRules.isIgnoredExtension(extension)) {
            return;
        }

        String rel = relativize(root, file);
        String lower = name.toLowerCase(Locale.ROOT);
        String topDir = topLevelDir(rel);

        state.totalFiles++;
        if (!extension.isEmpty()) {
            state.extensionCounts.merge(extension, 1, Integer::sum);
        }
        if (topDir != null) {
            state.topLevelDirs.merge(topDir, 1, Integer::sum);
        }

        // Tests
        if (WalkRules.isTestFile(lower, rel.toLowerCase(Locale.ROOT))) {
            state.hasTests = true;
            state.testFileCount++;
            if (topDir != null && !"src".equals(topDir)) {
                state.testDirs.add(topDir);
            }
        }
        WalkRules.testFrameworkMarker(lower).ifPresent(framework ->
                state.testFramework = WalkRules.resolveTestFramework(state.testFramework, framework));

        // CI/CD
        WalkRules.ciProvider(rel, lower).ifPresent(provider -> {
            state.hasCi = true;
            if (state.ciPlatform.isEmpty()) {
                state.ciPlatform = provider;
            }
            state.ciFiles.add(rel);
        });

        // Containers
        if (WalkRules.isContainerFile(lower)) {
            state.hasDocker = true;
            state.dockerFiles.add(rel);
        }
        if (WalkRules.isKubernetesManifest(lower)) {
            state.hasK8s = true;
        }

        // Documentation
        if (lower.equals("readme.md") && topDir == null) {
            state.hasReadme = true;
        } else if (lower.equals("contributing.md")) {
            state.hasContributing = true;
        } else if (WalkRules.isChangelog(lower)) {
            state.hasChangelog = true;
        } else if (WalkRules.isLicense(lower)) {
            state.hasLicense = true;
        }

        if (WalkRules.isConfigFile(lower)) {
            state.configFiles.add(rel);
        }
        if (WalkRules.isEntryPoint(lower)) {
            state.entryPoints.add(rel);
        }
    }

    private static String relativize(Path root, Path path) {
        return root.relativize(path).toString().replace(File.separatorChar, '/');
    }

    /** First segment of a relative file path, or null for files directly under the root. */
    private static String topLevelDir(String relativePath) {
        int slash = relativePath.indexOf('/');
        return slash < 0 ? null : relativePath.substring(0, slash);
    }

    /** Mutable per-walk accumulator; never escapes {@link #walk}. */
    private static final class WalkState {
        int totalFiles;
        int totalDirs;
        final Map<String, Integer> topLevelDirs = new LinkedHashMap<>();
        final Map<String, Integer> extensionCounts = new LinkedHashMap<>();
        boolean hasTests;
        String testFramework = "";
        final TreeSet<String> testDirs = new TreeSet<>();
        int testFileCount;
        boolean hasCi;
        String ciPlatform = "";
        final List<String> ciFiles = new ArrayList<>();
        boolean hasDocker;
        final List<String> dockerFiles = new ArrayList<>();
        boolean hasK8s;
        boolean hasReadme;
        boolean hasContributing;
        boolean hasChangelog;
        boolean hasLicense;
        final List<String> configFiles = new ArrayList<>();
        final List<String> entryPoints = new ArrayList<>();
        boolean truncated;
        final List<String> warnings = new ArrayList<>();

        TreeSummary toSummary() {
            return new TreeSummary(
                    totalFiles, totalDirs, topLevelDirs, extensionCounts,
                    hasTests, testFramework, new ArrayList<>(testDirs), testFileCount,
                    hasCi, ciPlatform, ciFiles,
                    hasDocker, dockerFiles, hasK8s,
                    hasReadme, hasContributing, hasChangelog, hasLicense,
                    configFiles, entryPoints,
                    truncated, warnings);
        }
    }
}
