package com.flow.core.validation;

import com.flow.core.model.Resources;
import com.flow.core.model.Task;
import com.flow.core.scheduler.ResourceBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Checks that every task carries a complete, positive resource requirement before
 * anything is scheduled. Stops at the first violation.
 */
@Service
public class ResourceValidator {

    private static final Logger log = LoggerFactory.getLogger(ResourceValidator.class);

    /**
     * @param tasks  tasks in workflow order
     * @param budget the global budget tasks must individually fit in
     * @throws MissingResourceSpecException    on the first incomplete requirement
     * @throws ResourceLimitExceededException  when a task alone exceeds the budget
     */
    public void validate(List<Task> tasks, ResourceBudget budget) {
        for (var task : tasks) {
            Resources r = task.resources();
            String name = task.analysisName();
            if (r == null || r.cpus() <= 0) {
                throw new MissingResourceSpecException(name, "cpus");
            }
            if (r.memoryMb() <= 0) {
                throw new MissingResourceSpecException(name, "memory");
            }
            if (r.timeLimitMinutes() <= 0) {
                throw new MissingResourceSpecException(name, "time");
            }
            if (r.containerRef() == null || r.containerRef().isBlank()) {
                throw new MissingResourceSpecException(name, "container");
            }
            if (budget.maxCpus() > 0 && r.cpus() > budget.maxCpus()) {
                throw new ResourceLimitExceededException(task.id(), "cpus", r.cpus(), budget.maxCpus());
            }
            if (budget.maxMemoryMb() > 0 && r.memoryMb() > budget.maxMemoryMb()) {
                throw new ResourceLimitExceededException(task.id(), "MB of memory", r.memoryMb(), budget.maxMemoryMb());
            }
        }
        log.debug("Resource requirements of {} tasks are complete", tasks.size());
    }
}
