package com.engram.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Engram.
 * Routes to subcommands: analyze.
 */
@Command(
        name = "engram",
        mixinStandardHelpOptions = true,
        version = "Engram 0.1.0",
        description = "Heuristic repository analysis",
        subcommands = {
                AnalyzeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class EngramCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
