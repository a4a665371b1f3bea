package com.conductor.dispatch.cli;

import com.conductor.core.model.JobState;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the conductor CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CONDUCTOR v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CONDUCTOR]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void job(String jobId, JobState state) {
        String color = switch (state) {
            case COMPLETED -> "fg(green)";
            case PENDING, RUNNING -> "fg(blue)";
            case CANCELLED, TIMED_OUT -> "fg(yellow)";
            case FAILED -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|" + color + " [JOB " + jobId + "]|@ " + state));
    }
}
