package com.taskweaver.dispatch.cli;

import com.taskweaver.core.model.ProjectStatistics;
import com.taskweaver.core.model.Task;
import com.taskweaver.core.validation.ValidationDiagnostic;
import picocli.CommandLine;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the TaskWeaver CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKWEAVER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKWEAVER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warning(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void diagnostics(List<ValidationDiagnostic> diagnostics) {
        for (var diagnostic : diagnostics) {
            warning("[" + diagnostic.code() + "] " + diagnostic.message());
        }
    }

    /**
     * Prints the task table; ids in {@code criticalIds} are highlighted.
     */
    public static void taskTable(List<Task> tasks, Set<String> criticalIds) {
        System.out.printf("  %-12s %-11s %-11s %5s  %-4s %s%n",
                "TASK", "START", "END", "DAYS", "CP", "NAME");
        System.out.println("  " + "-".repeat(64));
        for (var t : tasks) {
            String cp = criticalIds.contains(t.id()) ? "@|bold,fg(red) *|@" : " ";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                    "  %-12s %-11s %-11s %5s  %-4s %s%s",
                    t.id(), orDash(t.startDate()), orDash(t.endDate()), orDash(t.duration()),
                    cp, truncate(t.name(), 30), t.milestone() ? " (milestone)" : "")));
        }
    }

    public static void criticalPath(List<Task> path) {
        String chain = path.stream().map(Task::id).collect(Collectors.joining(" -> "));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(red) Critical path:|@ " + (chain.isEmpty() ? "-" : chain)));
    }

    public static void statistics(ProjectStatistics s) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Project Statistics|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: " + s.totalTasks() + " total, @|fg(green) " + s.completedTasks() + " done|@, "
                        + "@|fg(cyan) " + s.activeTasks() + " active|@, " + s.milestoneCount() + " milestones"));
        System.out.println("  Span: " + orDash(s.startDate()) + " .. " + orDash(s.endDate())
                + " (" + s.totalDuration() + " working days)");
        System.out.println(String.format(Locale.ROOT, "  Completion: %.1f%%", s.completionRate()));
        System.out.println("  Critical path: " + s.criticalPathLength() + " tasks"
                + (s.taggedCritical() > 0 ? " (" + s.taggedCritical() + " tagged crit)" : ""));
        if (!s.sections().isEmpty()) {
            System.out.println("  Sections: " + String.join(", ", s.sections()));
        }
    }

    static String orDash(Object value) {
        return value == null ? "-" : value.toString();
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
