package com.flow.core.scheduler;

import com.flow.core.model.Task;
import com.flow.core.model.TaskResult;

/**
 * Runs one task to completion in an isolated backend.
 *
 * <p>Implementations make exactly one attempt and release every resource the task
 * held before returning, whatever the outcome. Task failures are reported through
 * the returned {@link TaskResult}, not thrown.
 */
public interface TaskExecutor {

    /**
     * Blocks until the task finishes, fails, or exceeds its time limit.
     *
     * @param runId the run the task belongs to
     * @param task  the task to execute
     * @return the execution outcome
     */
    TaskResult execute(String runId, Task task);

    /**
     * Terminates the task if it is running. The blocked {@link #execute} call then
     * returns on its own. No-op for tasks that are not running.
     */
    void cancel(String runId, Task task);
}
