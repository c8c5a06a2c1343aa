package com.portos.dispatch.cli;

import com.portos.core.health.HealthStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the PortOS CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PORTOS ORCHESTRATOR v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PORTOS]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void field(String label, Object value) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + label + ":|@ " + value));
    }

    /** One line per health check, marked by severity. */
    public static void status(HealthStatus.Status status, String message) {
        switch (status) {
            case UP -> success(message);
            case DEGRADED -> warn(message);
            case DOWN -> error(message);
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
