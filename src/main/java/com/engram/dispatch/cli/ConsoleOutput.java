package com.engram.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Engram CLI.
 * Diagnostics go to stderr so stdout carries only the analysis itself.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ENGRAM v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void warn(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }
}
