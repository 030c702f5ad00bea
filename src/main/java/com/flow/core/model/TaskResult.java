package com.flow.core.model;

import java.io.Serializable;

/**
 * Outcome of executing a task once.
 *
 * @param exitCode      container exit code (0 = success, -1 when none was observed)
 * @param stdoutSummary trimmed tail of standard output
 * @param stderrSummary trimmed tail of standard error
 * @param durationMs    wall-clock time in milliseconds
 * @param reason        {@link FailureReason#NONE} on success
 */
public record TaskResult(
    int exitCode,
    String stdoutSummary,
    String stderrSummary,
    long durationMs,
    FailureReason reason
) implements Serializable {

    public boolean succeeded() {
        return reason == FailureReason.NONE;
    }

    public static TaskResult success(String stdout, String stderr, long durationMs) {
        return new TaskResult(0, stdout, stderr, durationMs, FailureReason.NONE);
    }

    public static TaskResult exited(int exitCode, String stdout, String stderr, long durationMs) {
        return new TaskResult(exitCode, stdout, stderr, durationMs,
                exitCode == 0 ? FailureReason.NONE : FailureReason.TASK_EXECUTION_FAILED);
    }

    public static TaskResult timedOut(String stdout, String stderr, long durationMs) {
        return new TaskResult(-1, stdout, stderr, durationMs, FailureReason.TIME_LIMIT_EXCEEDED);
    }

    public static TaskResult error(String message, long durationMs) {
        return new TaskResult(-1, "", message != null ? message : "", durationMs, FailureReason.RUNTIME_ERROR);
    }
}
