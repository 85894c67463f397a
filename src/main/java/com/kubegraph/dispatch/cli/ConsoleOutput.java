package com.kubegraph.dispatch.cli;

import com.kubegraph.core.events.DeploymentEvent;
import com.kubegraph.core.model.DeploymentResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Kubegraph CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) KUBEGRAPH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [KUBEGRAPH]|@ " + message));
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

    public static void level(int level, Object ids) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [LEVEL " + level + "]|@ " + ids));
    }

    public static void event(DeploymentEvent event) {
        String prefix = switch (event.type()) {
            case STARTED -> "@|fg(cyan) [STARTED]|@";
            case PROGRESS -> "@|fg(white) [PROGRESS]|@";
            case RESOURCE_STATUS -> "@|fg(blue) [RESOURCE]|@";
            case RESOURCE_READY -> "@|fg(green) [READY]|@";
            case RESOURCE_WARNING -> "@|fg(yellow) [WARNING]|@";
            case COMPLETED -> "@|fg(green),bold [COMPLETED]|@";
            case FAILED -> "@|fg(red),bold [FAILED]|@";
            case ROLLBACK -> "@|fg(magenta) [ROLLBACK]|@";
        };
        String subject = event.resourceId() != null ? event.resourceId() + ": " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + event.message()));
    }

    public static void summary(DeploymentResult result) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Deployment " + result.deploymentId() + "|@"));
        String color = switch (result.status()) {
            case SUCCESS -> "fg(green)";
            case PARTIAL -> "fg(yellow)";
            default -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Status: @|" + color + " " + result.status().wireName() + "|@"));
        for (var resource : result.resources()) {
            System.out.println("  " + resource.id() + " (" + resource.kind() + "): " + resource.status().wireName());
        }
        for (var error : result.errors()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ [" + error.phase() + "] "
                            + (error.resourceId() != null ? error.resourceId() + ": " : "") + error.message()));
        }
        if (!result.statusValues().isEmpty()) {
            System.out.println("  Status values: " + result.statusValues());
        }
        System.out.println("  Duration: " + formatDuration(result.duration().toMillis()));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
