package com.flow.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate result of one workflow run.
 *
 * @param runId       the run identifier
 * @param states      final state of every task, keyed by task id in workflow order
 * @param results     execution results of every task that ran, keyed by task id
 * @param timedOut    whether the run-level timeout expired
 * @param durationMs  wall-clock time of the whole run
 */
public record RunOutcome(
    String runId,
    Map<String, TaskState> states,
    Map<String, TaskResult> results,
    boolean timedOut,
    long durationMs
) implements Serializable {

    public RunOutcome {
        states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public static RunOutcome empty(String runId) {
        return new RunOutcome(runId, Map.of(), Map.of(), false, 0L);
    }

    /** True when no task failed or was cancelled and the run did not time out. */
    public boolean succeeded() {
        return !timedOut && failedTasks().isEmpty() && cancelledTasks().isEmpty();
    }

    public List<String> failedTasks() {
        return tasksIn(TaskState.FAILED);
    }

    public List<String> skippedTasks() {
        return tasksIn(TaskState.SKIPPED);
    }

    public List<String> cancelledTasks() {
        return tasksIn(TaskState.CANCELLED);
    }

    public List<String> succeededTasks() {
        return tasksIn(TaskState.SUCCEEDED);
    }

    public TaskState stateOf(String taskId) {
        return states.get(taskId);
    }

    public FailureReason failureReason(String taskId) {
        TaskResult result = results.get(taskId);
        return result != null ? result.reason() : null;
    }

    private List<String> tasksIn(TaskState state) {
        return states.entrySet().stream()
                .filter(e -> e.getValue() == state)
                .map(Map.Entry::getKey)
                .toList();
    }
}
