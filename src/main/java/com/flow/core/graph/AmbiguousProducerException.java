package com.flow.core.graph;

import com.flow.core.validation.WorkflowValidationException;

/**
 * Thrown when two tasks declare the same output path.
 */
public class AmbiguousProducerException extends WorkflowValidationException {

    private final String path;

    public AmbiguousProducerException(String path, String firstTaskId, String secondTaskId) {
        super(String.format("output %s is declared by both %s and %s", path, firstTaskId, secondTaskId));
        this.path = path;
    }

    public String path() {
        return path;
    }
}
