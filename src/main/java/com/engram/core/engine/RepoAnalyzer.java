package com.engram.core.engine;

import com.engram.core.config.EngramProperties;
import com.engram.core.history.HistoryProvider;
import com.engram.core.language.ExtensionClassifier;
import com.engram.core.logging.MdcContext;
import com.engram.core.manifest.LicenseDetector;
import com.engram.core.manifest.ManifestInterpreter;
import com.engram.core.manifest.ManifestReport;
import com.engram.core.metrics.AnalysisMetrics;
import com.engram.core.model.RepoAnalysis;
import com.engram.core.pattern.PatternDetector;
import com.engram.core.pattern.PatternInput;
import com.engram.core.scanner.TreeSummary;
import com.engram.core.scanner.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs every analysis stage over a local repository and assembles the {@link RepoAnalysis}.
 * <p>
 * The stage order is fixed: walk, languages, manifests, license, patterns, key files,
 * history. Past path validation nothing is thrown; a stage that fails is recorded as a
 * warning and leaves its fields empty.
 */
@Service
public class RepoAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RepoAnalyzer.class);

    private final TreeWalker treeWalker;
    private final ExtensionClassifier extensionClassifier;
    private final ManifestInterpreter manifestInterpreter;
    private final LicenseDetector licenseDetector;
    private final PatternDetector patternDetector;
    private final KeyFileReader keyFileReader;
    private final HistoryProvider historyProvider;
    private final EngramProperties properties;
    private final AnalysisMetrics metrics;

    public RepoAnalyzer(TreeWalker treeWalker,
                        ExtensionClassifier extensionClassifier,
                        ManifestInterpreter manifestInterpreter,
                        LicenseDetector licenseDetector,
                        PatternDetector patternDetector,
                        KeyFileReader keyFileReader,
                        HistoryProvider historyProvider,
                        EngramProperties properties,
                        AnalysisMetrics metrics) {
        this.treeWalker = treeWalker;
        this.extensionClassifier = extensionClassifier;
        this.manifestInterpreter = manifestInterpreter;
        this.licenseDetector = licenseDetector;
        this.patternDetector = patternDetector;
        this.keyFileReader = keyFileReader;
        this.historyProvider = historyProvider;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Analyzes {@code path} using the configured deadline and history limit.
     *
     * @throws InvalidRepositoryPathException if the path is not an existing directory
     */
    public RepoAnalysis analyze(Path path) {
        return analyze(path, Duration.ofSeconds(properties.getDeadlineSeconds()));
    }

    public RepoAnalysis analyze(Path path, Duration deadline) {
        return analyze(path, deadline, properties.getRecentCommitLimit());
    }

    /**
     * @param path         repository root
     * @param deadline     overall budget; null, zero or negative means unbounded
     * @param historyLimit maximum number of recent commits
     * @throws InvalidRepositoryPathException if the path is not an existing directory
     */
    public RepoAnalysis analyze(Path path, Duration deadline, int historyLimit) {
        Path root = path.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            metrics.recordAnalysisResult("rejected");
            throw new InvalidRepositoryPathException(root);
        }

        Deadline budget = Deadline.after(deadline);
        String name = root.getFileName() != null ? root.getFileName().toString() : root.toString();
        var acc = new AnalysisAccumulator();
        long start = System.currentTimeMillis();

        MdcContext.setRepository(root.toString());
        try {
            log.info("Analyzing {}", root);

            runPhase("walk", acc, () -> acc.applyTree(treeWalker.walk(root, budget),
                    properties.getTopDirLimit(), properties.getTopExtensionLimit()));

            runPhase("languages", acc, () -> {
                TreeSummary tree = acc.tree();
                if (tree != null) {
                    acc.setLanguages(extensionClassifier.classify(tree.extensionCounts()));
                }
            });

            runPhase("manifests", acc, () -> {
                ManifestReport report = manifestInterpreter.interpret(root);
                report.results().forEach(acc::addManifest);
                acc.addWarnings(report.warnings());
            });

            runPhase("license", acc, () -> {
                try {
                    licenseDetector.detect(root).ifPresent(acc::setLicenseType);
                } catch (IOException e) {
                    log.warn("Cannot read license file: {}", e.getMessage());
                    acc.addWarning("license: license file could not be read (" + e.getMessage() + ")");
                }
            });

            runPhase("patterns", acc, () -> acc.addPatterns(patternDetector.detect(patternInput(acc))));

            runPhase("key-files", acc, () -> {
                KeyFiles keyFiles = keyFileReader.read(root);
                keyFiles.contents().forEach(acc::putKeyFile);
                acc.setReadmeExcerpt(keyFiles.readmeExcerpt());
                acc.addWarnings(keyFiles.warnings());
            });

            runPhase("history", acc, () -> acc.applyHistory(historyProvider.extractHistory(root, historyLimit, budget)));

            RepoAnalysis analysis = acc.build(root.toString(), name);
            long elapsed = System.currentTimeMillis() - start;
            metrics.recordAnalysisDuration(elapsed);
            metrics.recordFilesScanned(analysis.totalFiles());
            metrics.recordAnalysisResult(analysis.warnings().isEmpty() ? "complete" : "degraded");
            log.info("Analyzed {} in {}ms: {} files, {} languages, {} warnings",
                    name, elapsed, analysis.totalFiles(), analysis.languages().size(), analysis.warnings().size());
            return analysis;
        } finally {
            MdcContext.clear();
        }
    }

    private void runPhase(String phase, AnalysisAccumulator acc, Runnable body) {
        MdcContext.setPhase(phase);
        int warningsBefore = acc.warningCount();
        long start = System.currentTimeMillis();
        try {
            body.run();
        } catch (RuntimeException e) {
            log.warn("Phase {} failed", phase, e);
            acc.addWarning(phase + ": unexpected failure (" + e + ")");
        } finally {
            metrics.recordPhaseDuration(phase, System.currentTimeMillis() - start);
            for (int i = acc.warningCount() - warningsBefore; i > 0; i--) {
                metrics.recordDegraded(phase);
            }
        }
    }

    private static PatternInput patternInput(AnalysisAccumulator acc) {
        TreeSummary tree = acc.tree();
        Map<String, Integer> topLevelDirs = tree != null ? tree.topLevelDirs() : Map.of();
        Set<String> extensions = tree != null ? tree.extensionCounts().keySet() : Set.of();
        List<String> configFiles = tree != null ? tree.configFiles() : List.of();

        var configFileNames = new HashSet<String>();
        for (String file : configFiles) {
            configFileNames.add(file.substring(file.lastIndexOf('/') + 1));
        }
        return new PatternInput(topLevelDirs.keySet(), acc.frameworks(), extensions,
                acc.description(), configFileNames);
    }
}
