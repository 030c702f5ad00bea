package com.flow.core.workflow;

/**
 * Thrown when a workflow file cannot be read or does not describe valid tasks.
 */
public class WorkflowDefinitionException extends RuntimeException {

    public WorkflowDefinitionException(String message) {
        super(message);
    }

    public WorkflowDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
