package com.flow.core.scheduler;

import com.flow.core.events.EventBus;
import com.flow.core.events.FlowEvent;
import com.flow.core.graph.TaskGraph;
import com.flow.core.logging.MdcContext;
import com.flow.core.metrics.FlowMetrics;
import com.flow.core.model.FailurePolicy;
import com.flow.core.model.RunOutcome;
import com.flow.core.model.Task;
import com.flow.core.model.TaskResult;
import com.flow.core.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a {@link TaskGraph} to completion.
 *
 * <p>The calling thread is the single coordination point: it owns the per-task state
 * table and the {@link ResourceBudget}, admits ready tasks in workflow order while the
 * budget allows, and blocks only on the completion queue. Each admitted task runs on
 * its own worker thread, which reports back exclusively through that queue.
 *
 * <p>A failed task skips every not-yet-started transitive dependent. What happens to
 * the rest of the graph is decided by the {@link FailurePolicy}.
 */
@Service
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private final TaskExecutor executor;
    private final EventBus eventBus;
    private final FlowMetrics metrics;

    public TaskScheduler(TaskExecutor executor, EventBus eventBus,
                         @Autowired(required = false) FlowMetrics metrics) {
        this.executor = executor;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Executes every task of the graph once, respecting dependencies and the budget.
     *
     * @param runId      identifier used for events, logs and executor calls
     * @param graph      the validated, acyclic graph
     * @param budget     global CPU/memory ceiling for concurrently running tasks
     * @param policy     behaviour after the first failure
     * @param runTimeout overall limit for the run; {@code null} or zero for none
     * @return the terminal state of every task
     * @throws InternalSchedulingException if an accounting invariant breaks
     */
    public RunOutcome schedule(String runId, TaskGraph graph, ResourceBudget budget,
                               FailurePolicy policy, Duration runTimeout) {
        var run = new Run(runId, graph, budget, policy);
        return run.execute(runTimeout);
    }

    /** A worker's report for one task. */
    private record Completion(int vertex, TaskResult result) {}

    /**
     * Mutable state of a single run. Only the coordinating thread touches it, except
     * {@link #completions} which workers append to.
     */
    private final class Run {

        private final String runId;
        private final TaskGraph graph;
        private final ResourceBudget budget;
        private final FailurePolicy policy;

        private final TaskState[] states;
        private final int[] unmet;
        private final TaskResult[] results;
        private final TreeSet<Integer> ready = new TreeSet<>();
        private final Set<Integer> running = new LinkedHashSet<>();
        private final Set<Integer> cancelRequested = new HashSet<>();
        private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
        private final ExecutorService workers;

        private boolean halted;
        private boolean timedOut;

        Run(String runId, TaskGraph graph, ResourceBudget budget, FailurePolicy policy) {
            this.runId = runId;
            this.graph = graph;
            this.budget = budget;
            this.policy = policy != null ? policy : FailurePolicy.FAIL_FAST;

            int n = graph.size();
            this.states = new TaskState[n];
            this.unmet = new int[n];
            this.results = new TaskResult[n];
            for (int v = 0; v < n; v++) {
                unmet[v] = graph.predecessors(v).size();
                if (unmet[v] == 0) {
                    states[v] = TaskState.READY;
                    ready.add(v);
                } else {
                    states[v] = TaskState.PENDING;
                }
            }

            var threadCounter = new AtomicInteger();
            this.workers = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "flow-task-" + threadCounter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }

        RunOutcome execute(Duration runTimeout) {
            long startMs = System.currentTimeMillis();
            long deadline = runTimeout != null && !runTimeout.isZero() && !runTimeout.isNegative()
                    ? System.nanoTime() + runTimeout.toNanos()
                    : Long.MAX_VALUE;

            log.info("Scheduling {} tasks (budget: {}, policy: {})", graph.size(), budget, policy);

            boolean clean = false;
            try {
                while (true) {
                    if (!halted) {
                        admitReady();
                    }
                    if (running.isEmpty()) {
                        if (halted) {
                            skipRemaining();
                        }
                        if (allTerminal()) {
                            break;
                        }
                        throw new InternalSchedulingException(String.format(
                                "no task running and none admissible: ready=%s, %s",
                                idsOf(ready), budget));
                    }

                    Completion completion = awaitCompletion(deadline);
                    if (completion == null) {
                        onRunTimeout();
                        deadline = Long.MAX_VALUE;
                        continue;
                    }
                    onCompletion(completion);
                }
                clean = true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Scheduler interrupted, cancelling {} running tasks", running.size());
                cancelRunning();
                for (int v : running) {
                    transition(v, TaskState.CANCELLED);
                }
                running.clear();
                skipRemaining();
                clean = true;
            } finally {
                if (!clean) {
                    cancelRunning();
                }
                workers.shutdown();
            }

            long elapsedMs = System.currentTimeMillis() - startMs;
            return buildOutcome(elapsedMs);
        }

        private Completion awaitCompletion(long deadline) throws InterruptedException {
            if (deadline == Long.MAX_VALUE) {
                return completions.take();
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return completions.poll();
            }
            return completions.poll(remaining, TimeUnit.NANOSECONDS);
        }

        /** First-fit over ready tasks in workflow order. */
        private void admitReady() {
            var it = ready.iterator();
            while (it.hasNext()) {
                int v = it.next();
                Task task = graph.task(v);
                if (!budget.tryAcquire(task.resources())) {
                    log.debug("  {} [{}] waiting for budget ({})", task.id(), task.analysisName(), budget);
                    continue;
                }
                it.remove();
                running.add(v);
                transition(v, TaskState.RUNNING);
                dispatch(v, task);
            }
        }

        private void dispatch(int vertex, Task task) {
            log.info("Starting task {} [{}] (cpus={}, memory={}MB, time={}m)",
                    task.id(), task.analysisName(), task.resources().cpus(),
                    task.resources().memoryMb(), task.resources().timeLimitMinutes());
            workers.execute(() -> {
                MdcContext.setTask(runId, task.id(), task.analysisName());
                TaskResult result = null;
                try {
                    result = executor.execute(runId, task);
                } catch (Exception e) {
                    log.error("Executor error running task {}: {}", task.id(), e.getMessage(), e);
                    result = TaskResult.error(e.getMessage(), 0L);
                } finally {
                    if (result == null) {
                        result = TaskResult.error("executor returned no result", 0L);
                    }
                    completions.add(new Completion(vertex, result));
                    MdcContext.clear();
                }
            });
        }

        private void onCompletion(Completion completion) {
            int v = completion.vertex();
            Task task = graph.task(v);
            if (!running.remove(v)) {
                throw new InternalSchedulingException(
                        "completion reported for task " + task.id() + " which is not running");
            }
            budget.release(task.resources());
            TaskResult result = completion.result();
            results[v] = result;
            if (metrics != null) {
                metrics.recordTaskExecution(task.analysisName(), result.durationMs());
            }

            if (result.succeeded()) {
                transition(v, TaskState.SUCCEEDED);
                for (int s : graph.successors(v)) {
                    if (--unmet[s] == 0 && states[s] == TaskState.PENDING) {
                        states[s] = TaskState.READY;
                        ready.add(s);
                    }
                }
                return;
            }

            if (cancelRequested.contains(v)) {
                transition(v, TaskState.CANCELLED);
                skipDependents(v);
                return;
            }

            log.warn("Task {} [{}] failed: {} (exit code {})",
                    task.id(), task.analysisName(), result.reason(), result.exitCode());
            transition(v, TaskState.FAILED);
            skipDependents(v);

            switch (policy) {
                case CONTINUE -> { }
                case FAIL_FAST -> halt("task " + task.id() + " failed");
                case CANCEL -> {
                    halt("task " + task.id() + " failed");
                    cancelRunning();
                }
            }
        }

        private void onRunTimeout() {
            log.warn("Run timeout expired with {} tasks running", running.size());
            timedOut = true;
            halt("run timeout expired");
            cancelRunning();
        }

        private void halt(String reason) {
            if (!halted) {
                halted = true;
                log.info("No further tasks will be started: {}", reason);
            }
        }

        private void cancelRunning() {
            for (int v : running) {
                if (cancelRequested.add(v)) {
                    Task task = graph.task(v);
                    try {
                        executor.cancel(runId, task);
                    } catch (RuntimeException e) {
                        log.warn("Failed to cancel task {}: {}", task.id(), e.getMessage(), e);
                    }
                }
            }
        }

        /** Cascading skip over every not-yet-started transitive dependent. */
        private void skipDependents(int failed) {
            var queue = new ArrayDeque<Integer>(graph.successors(failed));
            var seen = new HashSet<Integer>();
            while (!queue.isEmpty()) {
                int v = queue.poll();
                if (!seen.add(v)) continue;
                if (states[v] == TaskState.PENDING || states[v] == TaskState.READY) {
                    ready.remove(v);
                    transition(v, TaskState.SKIPPED);
                }
                queue.addAll(graph.successors(v));
            }
        }

        private void skipRemaining() {
            for (int v = 0; v < states.length; v++) {
                if (states[v] == TaskState.PENDING || states[v] == TaskState.READY) {
                    transition(v, TaskState.SKIPPED);
                }
            }
            ready.clear();
        }

        private boolean allTerminal() {
            for (TaskState state : states) {
                if (!state.isTerminal()) return false;
            }
            return true;
        }

        private void transition(int v, TaskState next) {
            Task task = graph.task(v);
            TaskState previous = states[v];
            states[v] = next;
            log.debug("  {} {} -> {}", task.id(), previous, next);

            String eventType = FlowEvent.typeFor(next);
            if (eventType == null) return;

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("analysis", task.analysisName());
            TaskResult result = results[v];
            if (result != null) {
                payload.put("exitCode", result.exitCode());
                payload.put("durationMs", result.durationMs());
                payload.put("reason", result.reason().name());
            }
            eventBus.publish(FlowEvent.of(eventType, runId, task.id(), payload));

            if (next.isTerminal() && metrics != null) {
                metrics.recordTaskOutcome(next);
            }
        }

        private RunOutcome buildOutcome(long elapsedMs) {
            var stateMap = new LinkedHashMap<String, TaskState>();
            var resultMap = new LinkedHashMap<String, TaskResult>();
            for (int v = 0; v < states.length; v++) {
                String id = graph.task(v).id();
                stateMap.put(id, states[v]);
                if (results[v] != null) {
                    resultMap.put(id, results[v]);
                }
            }
            return new RunOutcome(runId, stateMap, resultMap, timedOut, elapsedMs);
        }

        private String idsOf(Set<Integer> vertices) {
            return vertices.stream().map(v -> graph.task(v).id()).toList().toString();
        }
    }
}
