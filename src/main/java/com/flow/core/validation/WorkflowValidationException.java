package com.flow.core.validation;

/**
 * Base class for structural workflow errors detected before any task runs.
 * A run that raises one of these executes nothing.
 */
public class WorkflowValidationException extends RuntimeException {
    public WorkflowValidationException(String message) {
        super(message);
    }
}
