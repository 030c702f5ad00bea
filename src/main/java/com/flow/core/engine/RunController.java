package com.flow.core.engine;

import com.flow.core.config.FlowProperties;
import com.flow.core.config.ResourceCatalog;
import com.flow.core.events.EventBus;
import com.flow.core.events.FlowEvent;
import com.flow.core.graph.DependencyGraphBuilder;
import com.flow.core.graph.TaskGraph;
import com.flow.core.logging.MdcContext;
import com.flow.core.metrics.FlowMetrics;
import com.flow.core.model.RunOutcome;
import com.flow.core.model.Task;
import com.flow.core.scheduler.ResourceBudget;
import com.flow.core.scheduler.TaskScheduler;
import com.flow.core.validation.ResourceValidator;
import com.flow.core.validation.WorkflowValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for executing a workflow: validate, build the graph, schedule, report.
 * <p>
 * Structural problems surface as {@link WorkflowValidationException} before any task
 * starts. Per-task failures are reported in the returned {@link RunOutcome}.
 */
@Service
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);
    private static final DateTimeFormatter RUN_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final ResourceValidator validator;
    private final DependencyGraphBuilder graphBuilder;
    private final TaskScheduler scheduler;
    private final EventBus eventBus;
    private final FlowProperties properties;
    private final ResourceCatalog catalog;
    private final FlowMetrics metrics;

    public RunController(ResourceValidator validator, DependencyGraphBuilder graphBuilder,
                         TaskScheduler scheduler, EventBus eventBus, FlowProperties properties,
                         ResourceCatalog catalog, @Autowired(required = false) FlowMetrics metrics) {
        this.validator = validator;
        this.graphBuilder = graphBuilder;
        this.scheduler = scheduler;
        this.eventBus = eventBus;
        this.properties = properties;
        this.catalog = catalog;
        this.metrics = metrics;
    }

    /**
     * Runs a workflow, generating a new run ID.
     */
    public RunOutcome run(List<Task> tasks) {
        return run(generateRunId(), tasks);
    }

    /**
     * Runs a workflow under the given run ID.
     *
     * @param runId identifier for logs, events and the per-run log directory
     * @param tasks tasks in workflow order; an empty list is a successful no-op
     * @return final state of every task
     * @throws WorkflowValidationException if resources are incomplete or the graph is invalid
     */
    public RunOutcome run(String runId, List<Task> tasks) {
        MdcContext.setRun(runId);
        try {
            if (tasks.isEmpty()) {
                log.info("Run {}: no tasks to execute", runId);
                return RunOutcome.empty(runId);
            }

            ResourceBudget budget = catalog.newBudget();
            TaskGraph graph = validateAndBuild(tasks, budget);
            prepareRunDirectory(runId);

            log.info("Starting run {} with {} tasks and {} dependencies (policy {})",
                    runId, graph.size(), graph.edges().size(), properties.getFailurePolicy());
            eventBus.publish(FlowEvent.of(FlowEvent.RUN_STARTED, runId, null,
                    Map.of("tasks", graph.size(), "policy", properties.getFailurePolicy().name())));

            RunOutcome outcome = scheduler.schedule(runId, graph, budget,
                    properties.getFailurePolicy(), properties.runTimeout());

            log.info("Run {} {} in {}ms: {} succeeded, {} failed, {} skipped, {} cancelled{}",
                    runId, outcome.succeeded() ? "succeeded" : "failed", outcome.durationMs(),
                    outcome.succeededTasks().size(), outcome.failedTasks().size(),
                    outcome.skippedTasks().size(), outcome.cancelledTasks().size(),
                    outcome.timedOut() ? " (timed out)" : "");
            eventBus.publish(FlowEvent.of(FlowEvent.RUN_COMPLETED, runId, null,
                    Map.of("succeeded", outcome.succeeded(),
                            "failed", outcome.failedTasks(),
                            "skipped", outcome.skippedTasks(),
                            "timedOut", outcome.timedOut())));

            if (metrics != null) {
                metrics.recordRunResult(outcome.succeeded());
                metrics.recordRunDuration(outcome.durationMs());
            }
            return outcome;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Validates a workflow and builds its graph without executing anything.
     */
    public TaskGraph plan(List<Task> tasks) {
        return validateAndBuild(tasks, catalog.newBudget());
    }

    /**
     * Creates a queue that feeds tasks into this controller.
     */
    public TaskQueue newQueue() {
        return new TaskQueue(this, catalog);
    }

    private TaskGraph validateAndBuild(List<Task> tasks, ResourceBudget budget) {
        try {
            validator.validate(tasks, budget);
            return graphBuilder.build(tasks);
        } catch (WorkflowValidationException e) {
            log.error("Workflow rejected: {}", e.getMessage());
            if (metrics != null) {
                metrics.recordValidationFailure(e.getClass().getSimpleName());
            }
            throw e;
        }
    }

    private void prepareRunDirectory(String runId) {
        var dir = properties.flowdirPath().resolve(runId);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create run directory " + dir, e);
        }
    }

    /**
     * Generates a run ID in the format FLOW-yyyyMMdd-HHmmss-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        return String.format("FLOW-%s-%04d", LocalDateTime.now().format(RUN_TIMESTAMP), count);
    }
}
