package com.flow.core.events;

import com.flow.core.model.TaskState;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a workflow run, consumed by the CLI progress output.
 *
 * @param eventType one of the {@code RUN_*} / {@code TASK_*} constants
 * @param runId     the run this event belongs to
 * @param taskId    the task this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record FlowEvent(
    String eventType,
    String runId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RUN_STARTED = "run.started";
    public static final String RUN_COMPLETED = "run.completed";
    public static final String TASK_STARTED = "task.started";
    public static final String TASK_SUCCEEDED = "task.succeeded";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_SKIPPED = "task.skipped";
    public static final String TASK_CANCELLED = "task.cancelled";

    /**
     * Event type announcing that a task entered the given state, or {@code null} for
     * states that are not announced ({@code PENDING}, {@code READY}).
     */
    public static String typeFor(TaskState state) {
        return switch (state) {
            case RUNNING -> TASK_STARTED;
            case SUCCEEDED -> TASK_SUCCEEDED;
            case FAILED -> TASK_FAILED;
            case SKIPPED -> TASK_SKIPPED;
            case CANCELLED -> TASK_CANCELLED;
            default -> null;
        };
    }

    public boolean isTaskEvent() {
        return taskId != null;
    }

    public static FlowEvent of(String eventType, String runId, String taskId, Map<String, Object> payload) {
        return new FlowEvent(eventType, runId, taskId, payload, Instant.now());
    }
}
