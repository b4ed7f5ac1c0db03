package com.engram.core.engine;

import com.engram.core.config.EngramProperties;
import com.engram.core.history.HistoryProvider;
import com.engram.core.language.ExtensionClassifier;
import com.engram.core.manifest.LicenseDetector;
import com.engram.core.manifest.ManifestInterpreter;
import com.engram.core.metrics.AnalysisMetrics;
import com.engram.core.model.CommitInfo;
import com.engram.core.model.Contributor;
import com.engram.core.model.HistorySummary;
import com.engram.core.model.RepoAnalysis;
import com.engram.core.pattern.PatternDetector;
import com.engram.core.scanner.TreeWalker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link RepoAnalyzer} wired with the real components and a mocked history provider.
 */
class RepoAnalyzerTest {

    @TempDir
    Path tempDir;

    private HistoryProvider historyProvider;
    private SimpleMeterRegistry registry;
    private EngramProperties properties;
    private RepoAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        historyProvider = mock(HistoryProvider.class);
        when(historyProvider.extractHistory(any(Path.class), anyInt(), any(Deadline.class)))
                .thenReturn(HistorySummary.empty());
        registry = new SimpleMeterRegistry();
        properties = new EngramProperties();
        analyzer = newAnalyzer(new TreeWalker());
    }

    private RepoAnalyzer newAnalyzer(TreeWalker walker) {
        return new RepoAnalyzer(walker, new ExtensionClassifier(), new ManifestInterpreter(properties),
                new LicenseDetector(), new PatternDetector(), new KeyFileReader(properties),
                historyProvider, properties, new AnalysisMetrics(registry));
    }

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    // ── Scenarios ────────────────────────────────────────────────────

    @Test
    @DisplayName("web app with manifest, tests and CI is fully profiled")
    void webAppScenario() throws IOException {
        write("app.py", "from flask import Flask\napp = Flask(__name__)\n");
        write("requirements.txt", "flask==3.0\n");
        write("tests/test_app.py", "def test_index(): pass\n");
        write(".github/workflows/ci.yml", "on: push\n");

        RepoAnalysis analysis = analyzer.analyze(tempDir);

        assertTrue(analysis.frameworks().contains("Flask"));
        assertTrue(analysis.hasTests());
        assertEquals(1, analysis.testFileCount());
        assertTrue(analysis.hasCi());
        assertEquals("GitHub Actions", analysis.ciPlatform());
        assertEquals(List.of("pip"), analysis.packageManagers());
        assertEquals(List.of("app.py"), analysis.entryPoints());
        assertTrue(analysis.warnings().isEmpty());
    }

    @Test
    @DisplayName("empty directory yields an empty profile")
    void emptyDirectoryScenario() {
        RepoAnalysis analysis = analyzer.analyze(tempDir);

        assertEquals(0, analysis.totalFiles());
        assertTrue(analysis.languages().isEmpty());
        assertFalse(analysis.hasTests());
        assertFalse(analysis.hasCi());
        assertEquals(tempDir.getFileName().toString(), analysis.name());
    }

    @Test
    @DisplayName("a missing path fails before any component runs")
    void missingPathRejected() {
        Path missing = tempDir.resolve("does-not-exist");

        var e = assertThrows(InvalidRepositoryPathException.class, () -> analyzer.analyze(missing));
        assertTrue(e.getMessage().startsWith("Not a directory: "));
        verify(historyProvider, never()).extractHistory(any(Path.class), anyInt(), any(Deadline.class));
        assertEquals(1.0, registry.find("engram.analyses.total").tag("outcome", "rejected").counter().count());
    }

    @Test
    @DisplayName("a regular file is not a repository")
    void fileRejected() throws IOException {
        write("file.txt", "");
        assertThrows(InvalidRepositoryPathException.class, () -> analyzer.analyze(tempDir.resolve("file.txt")));
    }

    // ── Aggregation ──────────────────────────────────────────────────

    @Nested
    class Aggregation {

        @Test
        @DisplayName("description is first-writer-wins across manifests")
        void firstDescriptionWins() throws IOException {
            write("package.json", "{\"description\": \"From npm\"}");
            write("Cargo.toml", "[package]\ndescription = \"From cargo\"\n");

            assertEquals("From npm", analyzer.analyze(tempDir).description());
        }

        @Test
        @DisplayName("a malformed manifest leaves other ecosystems intact")
        void malformedManifestIsolated() throws IOException {
            write("package.json", "{ broken");
            write("go.mod", "module x\n\nrequire (\n\tgithub.com/gin-gonic/gin v1.9.1\n)\n");

            RepoAnalysis analysis = analyzer.analyze(tempDir);
            assertEquals(List.of("Gin"), analysis.frameworks());
            assertEquals(List.of("Go modules"), analysis.packageManagers());
            assertEquals(1, analysis.warnings().size());
        }

        @Test
        @DisplayName("shared Python manifests merge into one category without duplicates")
        void pythonManifestsMerge() throws IOException {
            write("requirements.txt", "requests\nflask\n");
            write("setup.py", "install_requires=[\n    'requests',\n]\n");

            RepoAnalysis analysis = analyzer.analyze(tempDir);
            assertEquals(List.of("pip"), analysis.packageManagers());
            List<String> python = analysis.dependencies().get("python");
            assertEquals(python.size(), python.stream().distinct().count());
            assertTrue(python.containsAll(List.of("requests", "flask")));
        }

        @Test
        @DisplayName("key files are capped and the readme excerpt is taken from README.md")
        void keyFiles() throws IOException {
            properties.getAnalysis().setKeyFileMaxChars(100);
            properties.getAnalysis().setReadmeExcerptChars(10);
            write("README.md", "r".repeat(500));
            write("go.mod", "module x\n");

            RepoAnalysis analysis = analyzer.analyze(tempDir);
            assertEquals(100, analysis.keyFileContents().get("README.md").length());
            assertEquals("module x\n", analysis.keyFileContents().get("go.mod"));
            assertEquals("r".repeat(10), analysis.readmeExcerpt());
            assertEquals(List.of("README.md", "go.mod"), List.copyOf(analysis.keyFileContents().keySet()));
        }

        @Test
        @DisplayName("license family is detected from the license file")
        void license() throws IOException {
            write("LICENSE", "MIT License");
            RepoAnalysis analysis = analyzer.analyze(tempDir);
            assertTrue(analysis.hasLicense());
            assertEquals("MIT", analysis.licenseType());
        }

        @Test
        @DisplayName("history facts and warnings are merged into the record")
        void historyMerged() {
            when(historyProvider.extractHistory(any(Path.class), anyInt(), any(Deadline.class)))
                    .thenReturn(new HistorySummary(
                            List.of(new CommitInfo("abcdef12", "Ada", "2024-05-02", "Fix")),
                            List.of(new Contributor("Ada", 3)), 3, "2024-01-01", "2024-05-02",
                            List.of("history: contributors unavailable (timed out after 10000ms)")));

            RepoAnalysis analysis = analyzer.analyze(tempDir);
            assertEquals(3, analysis.commitCount());
            assertEquals("2024-01-01", analysis.firstCommitDate());
            assertEquals("2024-05-02", analysis.lastCommitDate());
            assertEquals(1, analysis.warnings().size());
            assertEquals(1.0, registry.find("engram.analysis.degraded").tag("phase", "history").counter().count());
        }

        @Test
        @DisplayName("a stage that throws is recorded as a warning")
        void failingStageBecomesWarning() throws IOException {
            write("main.go", "package main\n");
            TreeWalker failing = mock(TreeWalker.class);
            when(failing.walk(any(Path.class), any(Deadline.class))).thenThrow(new IllegalStateException("boom"));

            RepoAnalysis analysis = newAnalyzer(failing).analyze(tempDir);
            assertEquals(0, analysis.totalFiles());
            assertTrue(analysis.warnings().get(0).startsWith("walk: unexpected failure"));
        }

        @Test
        @DisplayName("passes the requested history limit to the provider")
        void historyLimit() {
            analyzer.analyze(tempDir, Duration.ZERO, 7);
            verify(historyProvider).extractHistory(any(Path.class), org.mockito.ArgumentMatchers.eq(7), any(Deadline.class));
        }
    }

    // ── Properties ───────────────────────────────────────────────────

    @Test
    @DisplayName("two analyses of an unchanged directory are equal")
    void deterministic() throws IOException {
        write("src/components/Button.tsx", "");
        write("src/index.ts", "");
        write("package.json", "{\"dependencies\": {\"react\": \"18\"}}");
        write("docs/intro.md", "");

        assertEquals(analyzer.analyze(tempDir), analyzer.analyze(tempDir));
    }

    @Test
    @DisplayName("language percentages sum to about 100")
    void languagesSumToHundred() throws IOException {
        write("a.py", "");
        write("b.py", "");
        write("c.go", "");

        double sum = analyzer.analyze(tempDir).languages().values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(100.0, sum, 0.5);
    }

    @Test
    @DisplayName("records a timer for every phase")
    void phaseTimers() {
        analyzer.analyze(tempDir);
        for (String phase : List.of("walk", "languages", "manifests", "license", "patterns", "key-files", "history")) {
            assertNotNull(registry.find("engram.analysis.phase.duration").tag("phase", phase).timer(), phase);
        }
    }
}
