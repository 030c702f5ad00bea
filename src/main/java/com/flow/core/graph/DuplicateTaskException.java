package com.flow.core.graph;

import com.flow.core.validation.WorkflowValidationException;

/**
 * Thrown when two tasks in one workflow share an id.
 */
public class DuplicateTaskException extends WorkflowValidationException {
    public DuplicateTaskException(String taskId) {
        super("a task with id [" + taskId + "] is already defined");
    }
}
