package com.teamflow.dispatch.cli;

import com.teamflow.core.model.Epic;
import com.teamflow.core.model.ProgressReport;
import picocli.CommandLine;

import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the Teamflow CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TEAMFLOW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TEAMFLOW]|@ " + message));
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

    public static void epicLine(Epic epic) {
        System.out.printf("  %-32s %-14s v%-4d %s%n", epic.id(), epic.state(), epic.version(),
                truncate(epic.title(), 40));
    }

    public static void epicDetail(Epic epic) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold EPIC " + epic.id() + "|@"));
        System.out.println("Title:   " + epic.title());
        System.out.println("State:   " + epic.state() + " (v" + epic.version() + ")");
        if (epic.externalRef() != null) {
            System.out.println("Tracker: #" + epic.externalRef());
        }
        if (!epic.description().isBlank()) {
            System.out.println("Description: " + epic.description());
        }
        for (String objective : epic.objectives()) {
            System.out.println("  objective:  " + objective);
        }
        for (String constraint : epic.constraints()) {
            System.out.println("  constraint: " + constraint);
        }
    }

    public static void progress(ProgressReport report) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Progress|@ " + report.completionPercent() + "% of " + report.total() + " issue(s)"));
        String counts = report.byStatus().entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .map(e -> e.getKey().name().toLowerCase() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
        if (!counts.isEmpty()) {
            System.out.println("  " + counts);
        }
        System.out.printf("  Active: %d | Available: %d | Waiting on dependencies: %d | Velocity: %.2f/day%n",
                report.activeWork(), report.availableWork(), report.blockedByDependencies(),
                report.velocityPerDay());
        for (var flag : report.riskFlags()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(red),bold [RISK]|@ " + flag));
        }
    }

    static String truncate(String value, int max) {
        if (value == null) return "";
        return value.length() <= max ? value : value.substring(0, max - 3) + "...";
    }
}
