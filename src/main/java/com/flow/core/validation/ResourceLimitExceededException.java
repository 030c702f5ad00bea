package com.flow.core.validation;

/**
 * Thrown when a single task asks for more than the configured global budget,
 * so it could never be admitted.
 */
public class ResourceLimitExceededException extends WorkflowValidationException {

    private final String taskId;

    public ResourceLimitExceededException(String taskId, String resource, long requested, long limit) {
        super(String.format("task %s requests %d %s but the budget allows at most %d",
                taskId, requested, resource, limit));
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
