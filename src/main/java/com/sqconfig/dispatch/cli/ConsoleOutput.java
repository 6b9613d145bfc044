package com.sqconfig.dispatch.cli;

import com.sqconfig.core.runner.RunSummary;
import picocli.CommandLine;

import java.io.PrintStream;

/**
 * ANSI-colored status output. Written to stderr: stdout is reserved for exported
 * documents and audit reports.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    private static PrintStream out() {
        return System.err;
    }

    public static void printBanner() {
        out().println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SQCONFIG v0.1.0|@"));
        out().println("──────────────────────────────────");
    }

    public static void info(String message) {
        out().println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SQCONFIG]|@ " + message));
    }

    public static void success(String message) {
        out().println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        out().println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        out().println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void separator() {
        out().println("──────────────────────────────────");
    }

    public static void runSummary(String what, RunSummary summary) {
        var line = "  " + what + ": @|fg(green) " + summary.succeeded() + " ok|@";
        if (summary.failed() > 0) {
            line += ", @|fg(red) " + summary.failed() + " failed|@ " + summary.failures();
        }
        out().println(CommandLine.Help.Ansi.AUTO.string(line));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
