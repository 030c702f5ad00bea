package com.flow.core.metrics;

import com.flow.core.model.TaskState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for workflow execution.
 */
@Service
public class FlowMetrics {

    private final MeterRegistry registry;

    public FlowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String analysisName, long ms) {
        Timer.builder("flow.task.duration")
                .tag("analysis", analysisName)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskOutcome(TaskState state) {
        Counter.builder("flow.tasks.total")
                .tag("state", state.name())
                .register(registry)
                .increment();
    }

    public void recordRunResult(boolean succeeded) {
        Counter.builder("flow.runs.total")
                .tag("result", succeeded ? "succeeded" : "failed")
                .register(registry)
                .increment();
    }

    public void recordRunDuration(long ms) {
        Timer.builder("flow.run.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a structural rejection (missing resources, cycle, ambiguous producer)
     * tagged with the exception's simple name.
     */
    public void recordValidationFailure(String kind) {
        Counter.builder("flow.validation.failures")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
