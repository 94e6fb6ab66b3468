package com.conclave.dispatch.cli;

import com.conclave.core.events.ConclaveEvent;
import com.conclave.core.model.AnalysisResult;
import com.conclave.core.model.ConflictMatrix;
import com.conclave.core.model.RunReport;
import com.conclave.core.model.Task;
import com.conclave.core.model.TaskReport;
import com.conclave.core.model.TaskStatus;
import picocli.CommandLine;

import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for Conclave CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CONCLAVE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CONCLAVE]|@ " + message));
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

    public static void group(int groupNumber, int groupCount, int taskCount) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [GROUP " + groupNumber + "/" + groupCount + "]|@ dispatching " +
                taskCount + " task" + (taskCount != 1 ? "s" : "")));
    }

    public static void taskStatus(String taskId, TaskStatus status, String detail) {
        String color = switch (status) {
            case SUCCEEDED -> "fg(green)";
            case FAILED, TIMED_OUT -> "fg(red)";
            case CANCELLED -> "fg(yellow)";
            default -> "fg(cyan)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + status + "|@ " + taskId + (detail != null ? " (" + detail + ")" : "")));
    }

    /**
     * One line of live progress per event.
     */
    public static void event(ConclaveEvent event) {
        Map<String, Object> payload = event.payload();
        String task = event.taskId() != null ? event.taskId() + " " : "";
        String prefix = switch (event.eventType()) {
            case ConclaveEvent.RUN_STARTED -> "@|fg(cyan) [RUN]|@";
            case ConclaveEvent.GROUP_STARTED -> "@|bold,fg(yellow) [GROUP]|@";
            case ConclaveEvent.TASK_STARTED, ConclaveEvent.TASK_COMPLETED -> "@|fg(blue) [TASK]|@";
            case ConclaveEvent.TASK_RETRYING -> "@|fg(yellow) [RETRY]|@";
            case ConclaveEvent.TASK_FAILED, ConclaveEvent.TASK_CANCELLED -> "@|fg(red) [TASK]|@";
            case ConclaveEvent.CIRCUIT_OPENED, ConclaveEvent.CIRCUIT_CLOSED -> "@|fg(magenta),bold [CIRCUIT]|@";
            case ConclaveEvent.RUN_COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String details = payload.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + event.eventType() + " " + task + details));
    }

    public static void plan(AnalysisResult analysis) {
        var index = analysis.taskIndex();
        System.out.println();
        System.out.println("TASKS:");
        for (Task task : analysis.tasks()) {
            System.out.printf("  %-12s [%-6s %5.2f ~%s] %s%s%n", task.id(), task.complexity(),
                    task.complexityScore(), formatDuration(task.estimatedDuration()), task.title(),
                    task.dependencies().isEmpty() ? "" : " <- " + String.join(", ", task.dependencies()));
        }
        System.out.println();
        System.out.println("GROUPS:");
        for (int i = 0; i < analysis.groups().size(); i++) {
            var group = analysis.groups().get(i);
            System.out.printf("  %d. %s%n", i + 1, group.stream()
                    .map(id -> id + (index.containsKey(id) ? "" : "?"))
                    .collect(Collectors.joining(", ")));
        }
        var conflicts = analysis.conflicts().entries();
        System.out.println();
        if (conflicts.isEmpty()) {
            System.out.println("CONFLICTS: none");
            return;
        }
        System.out.println("CONFLICTS:");
        for (ConflictMatrix.Entry entry : conflicts) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) " + entry.first() + " x " + entry.second() + "|@ " +
                    entry.descriptor().dimensions() + " " + String.join("; ", entry.descriptor().reasons())));
        }
    }

    public static void report(RunReport report) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Run " + report.runId() + "|@ " + report.phase()));
        for (TaskReport task : report.tasks()) {
            String detail = "attempts " + task.attempts() + ", " + formatDuration(task.duration())
                    + (task.errorMessage() != null ? ", " + task.errorMessage() : "");
            taskStatus(task.taskId(), task.status(), detail);
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: @|fg(green) " + report.count(TaskStatus.SUCCEEDED) + " succeeded|@, @|fg(red) " +
                report.count(TaskStatus.FAILED) + " failed|@, " + report.count(TaskStatus.CANCELLED) + " cancelled"));
        System.out.println("  Duration: " + formatDuration(report.elapsed()));
        for (String warning : report.checkpointWarnings()) {
            warn(warning);
        }
        if (!report.resumable()) {
            warn("Checkpointing failed during this run; it may not be resumable");
        }
        if (report.fatalError() != null) {
            error("Fatal: " + report.fatalError());
        }
    }

    static String formatDuration(Duration duration) {
        if (duration == null) return "-";
        long ms = duration.toMillis();
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
