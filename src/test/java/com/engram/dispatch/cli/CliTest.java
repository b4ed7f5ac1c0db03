package com.engram.dispatch.cli;

import com.engram.core.config.EngramProperties;
import com.engram.core.engine.InvalidRepositoryPathException;
import com.engram.core.engine.RepoAnalyzer;
import com.engram.core.model.RepoAnalysis;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Engram CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, and execution behavior.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static RepoAnalysis analysis() {
        return new RepoAnalysis("/work/shop", "shop", "Online shop",
                3, 1, Map.of("src", 2), Map.of(".py", 3),
                Map.of("Python", 100.0), List.of("Flask"), List.of("pip"), Map.of("python", List.of("flask")),
                false, "", List.of(), 0,
                false, "", List.of(),
                false, List.of(), false,
                false, "", false, false, false, "",
                List.of(), List.of(), 0, "", "",
                List.of(), List.of(), List.of(), Map.of(),
                List.of("history: contributors unavailable (timed out after 10000ms)"));
    }

    private CommandLine.IFactory createFactory(RepoAnalyzer analyzer) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == AnalyzeCommand.class) {
                    return (K) new AnalyzeCommand(analyzer, new EngramProperties());
                }
                // Default: use picocli's default factory for other classes
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(RepoAnalyzer analyzer, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new EngramCommand(), createFactory(analyzer));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private CliResult execute(String... args) {
        return execute(mock(RepoAnalyzer.class), args);
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists the analyze subcommand")
        void helpListsAnalyze() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("analyze"));
            assertTrue(result.output().contains("Heuristic repository analysis"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Engram 0.1.0"));
        }

        @Test
        @DisplayName("analyze --help shows its options")
        void analyzeHelp() {
            CliResult result = execute("analyze", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--json"));
            assertTrue(result.output().contains("--deadline-seconds"));
            assertTrue(result.output().contains("--history-limit"));
        }
    }

    @Nested
    @DisplayName("Analyze command")
    class AnalyzeTests {

        @Test
        @DisplayName("prints the text summary and warnings")
        void printsSummary() {
            RepoAnalyzer analyzer = mock(RepoAnalyzer.class);
            when(analyzer.analyze(any(Path.class), any(Duration.class), anyInt())).thenReturn(analysis());

            CliResult result = execute(analyzer, "analyze", "/work/shop");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Repository: shop"));
            assertTrue(result.output().contains("Frameworks: Flask"));
            assertTrue(result.output().contains("contributors unavailable"));
        }

        @Test
        @DisplayName("--json prints the snake_case record")
        void printsJson() {
            RepoAnalyzer analyzer = mock(RepoAnalyzer.class);
            when(analyzer.analyze(any(Path.class), any(Duration.class), anyInt())).thenReturn(analysis());

            CliResult result = execute(analyzer, "analyze", "--json", "/work/shop");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("\"total_files\" : 3"));
            assertFalse(result.output().contains("Repository: shop"));
        }

        @Test
        @DisplayName("an invalid path exits with code 1")
        void invalidPath() {
            RepoAnalyzer analyzer = mock(RepoAnalyzer.class);
            when(analyzer.analyze(any(Path.class), any(Duration.class), anyInt()))
                    .thenThrow(new InvalidRepositoryPathException(Path.of("/nope")));

            CliResult result = execute(analyzer, "analyze", "/nope");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Not a directory: /nope"));
        }

        @Test
        @DisplayName("options are passed through to the analyzer")
        void optionsPassedThrough() {
            RepoAnalyzer analyzer = mock(RepoAnalyzer.class);
            when(analyzer.analyze(any(Path.class), any(Duration.class), anyInt())).thenReturn(analysis());

            execute(analyzer, "analyze", "--deadline-seconds", "5", "--history-limit", "3", "/work/shop");
            verify(analyzer).analyze(eq(Path.of("/work/shop")), eq(Duration.ofSeconds(5)), eq(3));
        }

        @Test
        @DisplayName("defaults the path to the current directory")
        void defaultPath() {
            RepoAnalyzer analyzer = mock(RepoAnalyzer.class);
            when(analyzer.analyze(any(Path.class), any(Duration.class), anyInt())).thenReturn(analysis());

            execute(analyzer, "analyze");
            verify(analyzer).analyze(eq(Path.of(".")), eq(Duration.ZERO), eq(30));
        }

        @Test
        @DisplayName("negative limits are a usage error")
        void negativeLimit() {
            CliResult result = execute("analyze", "--history-limit=-1");
            assertEquals(2, result.exitCode());
        }
    }
}
