package com.flow.core.model;

/**
 * Runtime status of a task within one run.
 */
public enum TaskState {
    PENDING,
    READY,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED,    // never started because a dependency failed or the run stopped admitting
    CANCELLED;  // was running when the run was hard-cancelled

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED || this == CANCELLED;
    }
}
