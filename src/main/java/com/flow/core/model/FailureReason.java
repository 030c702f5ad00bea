package com.flow.core.model;

/**
 * Why a task execution did not succeed.
 */
public enum FailureReason {
    NONE,
    TASK_EXECUTION_FAILED,
    TIME_LIMIT_EXCEEDED,
    RUNTIME_ERROR
}
