package com.flow.dispatch.cli;

import com.flow.core.events.FlowEvent;
import com.flow.core.model.RunOutcome;
import com.flow.core.model.TaskResult;
import com.flow.core.model.TaskState;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Flow CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FLOW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FLOW]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void event(FlowEvent event) {
        String prefix = switch (event.eventType()) {
            case FlowEvent.RUN_STARTED -> "@|fg(cyan) [RUN]|@";
            case FlowEvent.TASK_STARTED -> "@|fg(blue) [START]|@";
            case FlowEvent.TASK_SUCCEEDED -> "@|fg(green) [DONE]|@";
            case FlowEvent.TASK_FAILED -> "@|fg(red),bold [FAILED]|@";
            case FlowEvent.TASK_SKIPPED -> "@|fg(yellow) [SKIPPED]|@";
            case FlowEvent.TASK_CANCELLED -> "@|fg(magenta) [CANCELLED]|@";
            case FlowEvent.RUN_COMPLETED -> "@|bold [COMPLETE]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.isTaskEvent() ? event.taskId() : event.runId();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject));
    }

    public static void outcome(RunOutcome outcome) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run " + outcome.runId() + "|@"));
        for (var entry : outcome.states().entrySet()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  " + stateLabel(entry.getValue()) + " " + entry.getKey()));
            TaskResult result = outcome.results().get(entry.getKey());
            if (result != null && !result.succeeded() && !result.stderrSummary().isBlank()) {
                System.out.println("      " + lastLine(result.stderrSummary()));
            }
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: @|fg(green) " + outcome.succeededTasks().size() + " succeeded|@, @|fg(red) " +
                outcome.failedTasks().size() + " failed|@, " +
                outcome.skippedTasks().size() + " skipped, " +
                outcome.cancelledTasks().size() + " cancelled"));
        System.out.println("  Duration: " + formatDuration(outcome.durationMs()));
        if (outcome.timedOut()) {
            error("Run timeout expired");
        }
    }

    private static String stateLabel(TaskState state) {
        return switch (state) {
            case SUCCEEDED -> "@|fg(green) SUCCEEDED|@";
            case FAILED -> "@|fg(red) FAILED   |@";
            case CANCELLED -> "@|fg(magenta) CANCELLED|@";
            case SKIPPED -> "@|fg(yellow) SKIPPED  |@";
            default -> state.name();
        };
    }

    private static String lastLine(String text) {
        String[] lines = text.strip().split("\n");
        return lines[lines.length - 1];
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
