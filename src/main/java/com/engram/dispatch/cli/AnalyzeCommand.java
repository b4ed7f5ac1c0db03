package com.engram.dispatch.cli;

import com.engram.core.config.EngramProperties;
import com.engram.core.engine.AnalysisJson;
import com.engram.core.engine.AnalysisSummary;
import com.engram.core.engine.InvalidRepositoryPathException;
import com.engram.core.engine.RepoAnalyzer;
import com.engram.core.model.RepoAnalysis;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: engram analyze [PATH]
 * <p>
 * Analyzes a local repository and prints either the text summary or the JSON record.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true, description = "Analyze a local repository")
@Component
public class AnalyzeCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", defaultValue = ".",
            description = "Repository directory (default: ${DEFAULT-VALUE})")
    private Path path;

    @Option(names = {"--json"}, description = "Print the full analysis as JSON")
    private boolean json;

    @Option(names = {"--deadline-seconds"},
            description = "Stop walking and querying history after this many seconds (0 = no limit)")
    private Integer deadlineSeconds;

    @Option(names = {"--history-limit", "-n"}, description = "Number of recent commits to include")
    private Integer historyLimit;

    private final RepoAnalyzer repoAnalyzer;
    private final EngramProperties properties;

    public AnalyzeCommand(RepoAnalyzer repoAnalyzer, EngramProperties properties) {
        this.repoAnalyzer = repoAnalyzer;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        int seconds = deadlineSeconds != null ? deadlineSeconds : properties.getDeadlineSeconds();
        int limit = historyLimit != null ? historyLimit : properties.getRecentCommitLimit();
        if (seconds < 0 || limit < 0) {
            ConsoleOutput.error("--deadline-seconds and --history-limit must not be negative");
            return CommandLine.ExitCode.USAGE;
        }

        RepoAnalysis analysis;
        try {
            analysis = repoAnalyzer.analyze(path, Duration.ofSeconds(seconds), limit);
        } catch (InvalidRepositoryPathException e) {
            ConsoleOutput.error(e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        }

        if (json) {
            System.out.println(AnalysisJson.toJson(analysis));
        } else {
            ConsoleOutput.printBanner();
            System.out.println(AnalysisSummary.render(analysis));
            for (String warning : analysis.warnings()) {
                ConsoleOutput.warn(warning);
            }
        }
        return CommandLine.ExitCode.OK;
    }
}
