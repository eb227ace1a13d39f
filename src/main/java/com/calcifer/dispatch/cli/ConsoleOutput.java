package com.calcifer.dispatch.cli;

import com.calcifer.core.model.HostGroup;
import com.calcifer.core.model.RunReport;
import com.calcifer.core.model.RunStatus;
import com.calcifer.core.model.TaskResult;
import com.calcifer.core.model.TaskStatus;
import com.calcifer.core.registry.ExecutionPlan;
import com.calcifer.core.registry.Step;
import com.calcifer.core.task.Task;
import picocli.CommandLine;

import java.time.Duration;
import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Calcifer CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CALCIFER v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CALCIFER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void runStarted(String runId, String goal, int hosts) {
        info("Run " + runId + ": " + goal + " on " + hosts + " host" + (hosts != 1 ? "s" : ""));
    }

    public static void step(String group, List<String> hosts) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [" + group + "]|@ " + String.join(", ", hosts)));
    }

    public static void emptyStep(String group) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|faint [" + group + "] no matching hosts, skipped|@"));
    }

    /**
     * One line per task result. In quiet mode only results that need attention are printed.
     */
    public static void taskResult(TaskResult result, boolean quiet) {
        if (quiet && (result.status() == TaskStatus.OK || result.status() == TaskStatus.SKIPPED)) {
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %s %-14s %-22s %s",
                statusLabel(result.status()), result.hostId(), result.taskName(), result.message())));
    }

    public static void aborted(String reason) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red),bold [ABORTED]|@ " + reason));
    }

    public static void summary(RunReport report) {
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Run " + report.runId() + " (" + report.goal().cliName() + ")|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: " + report.results().size()
                        + ", @|fg(green) " + report.countByStatus(TaskStatus.OK) + " ok|@"
                        + ", @|fg(yellow) " + report.countByStatus(TaskStatus.CHANGED) + " changed|@"
                        + ", @|fg(yellow) " + report.countByStatus(TaskStatus.WARNING) + " warning|@"
                        + ", @|fg(red) " + report.countByStatus(TaskStatus.FAILED) + " failed|@"
                        + ", " + report.countByStatus(TaskStatus.SKIPPED) + " skipped"));
        System.out.println("  Duration: " + formatDuration(report.duration()));
        for (TaskResult failure : report.failures()) {
            error(failure.hostId() + " / " + failure.taskName() + ": " + failure.message());
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Result: " + rollupLabel(report.status())));
    }

    public static void plan(ExecutionPlan plan, PlanHosts hosts) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Plan for " + plan.goal().cliName() + "|@ (" + plan.steps().size() + " steps, "
                        + plan.taskCount() + " tasks)"));
        int index = 1;
        for (Step step : plan.steps()) {
            List<String> names = hosts.namesIn(step.group());
            String target = names == null ? "" : names.isEmpty() ? " @|faint (no hosts)|@" : " " + String.join(", ", names);
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|bold,fg(yellow) " + index++ + ". [" + step.group() + "]|@" + target));
            for (Task task : step.tasks()) {
                System.out.printf("     - %-22s %s%n", task.name(), task.description());
            }
        }
    }

    private static String statusLabel(TaskStatus status) {
        return switch (status) {
            case OK -> "@|fg(green) OK     |@";
            case CHANGED -> "@|fg(yellow) CHANGED|@";
            case WARNING -> "@|fg(yellow),bold WARNING|@";
            case FAILED -> "@|fg(red),bold FAILED |@";
            case SKIPPED -> "@|faint SKIPPED|@";
        };
    }

    private static String rollupLabel(RunStatus status) {
        return switch (status) {
            case OK -> "@|fg(green),bold OK|@";
            case WARNING -> "@|fg(yellow),bold WARNING|@";
            case FAILED -> "@|fg(red),bold FAILED|@";
        };
    }

    private static String formatDuration(Duration duration) {
        long ms = duration.toMillis();
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    /**
     * Host names per group for plan rendering; returns null when no inventory is available.
     */
    @FunctionalInterface
    public interface PlanHosts {
        List<String> namesIn(HostGroup group);
    }
}
