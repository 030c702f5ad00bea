package com.flow.core.validation;

/**
 * Thrown when a task lacks one of cpus, memory, time or container.
 */
public class MissingResourceSpecException extends WorkflowValidationException {

    private final String analysisName;
    private final String field;

    public MissingResourceSpecException(String analysisName, String field) {
        super(String.format("no %s resource for %s", field, analysisName));
        this.analysisName = analysisName;
        this.field = field;
    }

    public String analysisName() {
        return analysisName;
    }

    /** One of "cpus", "memory", "time", "container". */
    public String field() {
        return field;
    }
}
