package com.flow.core.model;

/**
 * What the scheduler does with the rest of the workflow once a task fails.
 * <p>
 * FAIL_FAST: admit nothing new, let running tasks finish, skip everything else.
 * CONTINUE: keep running independent branches, skip only the failed task's dependents.
 * CANCEL: like FAIL_FAST, but running tasks are terminated and reported CANCELLED.
 */
public enum FailurePolicy {
    FAIL_FAST,
    CONTINUE,
    CANCEL
}
