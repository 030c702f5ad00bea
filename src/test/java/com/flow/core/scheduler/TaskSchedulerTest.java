package com.flow.core.scheduler;

import com.flow.core.events.EventBus;
import com.flow.core.events.FlowEvent;
import com.flow.core.graph.DependencyGraphBuilder;
import com.flow.core.model.FailurePolicy;
import com.flow.core.model.FailureReason;
import com.flow.core.model.Resources;
import com.flow.core.model.RunOutcome;
import com.flow.core.model.Task;
import com.flow.core.model.TaskResult;
import com.flow.core.model.TaskState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class TaskSchedulerTest {

    private RecordingExecutor executor;
    private EventBus eventBus;
    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = new RecordingExecutor();
        eventBus = new EventBus();
        scheduler = new TaskScheduler(executor, eventBus, null);
    }

    private static Task task(String id, List<String> inputs, List<String> outputs, int cpus) {
        return task(id, inputs, outputs, cpus, 100);
    }

    private static Task task(String id, List<String> inputs, List<String> outputs, int cpus, int memoryMb) {
        return new Task(id, "analysis", "run " + id, inputs, outputs,
                new Resources(cpus, memoryMb, 1, "docker://img"));
    }

    private static Task task(String id, List<String> inputs, List<String> outputs) {
        return task(id, inputs, outputs, 1);
    }

    private RunOutcome run(List<Task> tasks, ResourceBudget budget, FailurePolicy policy) {
        return run(tasks, budget, policy, null);
    }

    private RunOutcome run(List<Task> tasks, ResourceBudget budget, FailurePolicy policy, Duration timeout) {
        var graph = new DependencyGraphBuilder().build(tasks);
        return scheduler.schedule("RUN-1", graph, budget, policy, timeout);
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("linear chain runs in dependency order")
        void linearChain() {
            var tasks = List.of(
                    task("A", List.of("/in"), List.of("/a")),
                    task("B", List.of("/a"), List.of("/b")),
                    task("C", List.of("/b"), List.of("/c")));

            var outcome = run(tasks, ResourceBudget.unlimited(), FailurePolicy.FAIL_FAST);

            assertTrue(outcome.succeeded());
            assertEquals(List.of("start:A", "end:A", "start:B", "end:B", "start:C", "end:C"), executor.timeline());
        }

        @Test
        @DisplayName("A -> B, A -> C: B and C start only after A and overlap")
        void fanOutRunsInParallel() {
            var bothStarted = new CountDownLatch(2);
            Function<Task, TaskResult> meetAndSucceed = t -> {
                bothStarted.countDown();
                return await(bothStarted) ? TaskResult.success("", "", 1) : TaskResult.error("no overlap", 1);
            };
            executor.behave("B", meetAndSucceed);
            executor.behave("C", meetAndSucceed);

            var tasks = List.of(
                    task("A", List.of(), List.of("/a")),
                    task("B", List.of("/a"), List.of("/b")),
                    task("C", List.of("/a"), List.of("/c")));

            var outcome = run(tasks, ResourceBudget.unlimited(), FailurePolicy.FAIL_FAST);

            assertTrue(outcome.succeeded(), () -> "outcome: " + outcome.states());
            var timeline = executor.timeline();
            assertTrue(timeline.indexOf("end:A") < timeline.indexOf("start:B"));
            assertTrue(timeline.indexOf("end:A") < timeline.indexOf("start:C"));
        }

        @Test
        @DisplayName("every task runs exactly once")
        void eachTaskRunsOnce() {
            var tasks = List.of(
                    task("A", List.of(), List.of("/a")),
                    task("B", List.of("/a"), List.of("/b")),
                    task("C", List.of("/a"), List.of("/c")),
                    task("D", List.of("/b", "/c"), List.of("/d")));

            var outcome = run(tasks, ResourceBudget.unlimited(), FailurePolicy.FAIL_FAST);

            assertTrue(outcome.succeeded());
            for (String id : List.of("A", "B", "C", "D")) {
                assertEquals(1, Collections.frequency(executor.timeline(), "start:" + id), id);
            }
            var timeline = executor.timeline();
            assertTrue(timeline.indexOf("end:B") < timeline.indexOf("start:D"));
            assertTrue(timeline.indexOf("end:C") < timeline.indexOf("start:D"));
        }

        @Test
        @DisplayName("empty graph completes immediately")
        void emptyGraph() {
            var outcome = run(List.of(), ResourceBudget.unlimited(), FailurePolicy.FAIL_FAST);

            assertTrue(outcome.succeeded());
            assertTrue(outcome.states().isEmpty());
            assertTrue(executor.timeline().isEmpty());
        }
    }

    @Nested
    @DisplayName("Resource budget")
    class BudgetTests {

        @Test
        @DisplayName("concurrent CPU use never exceeds the budget")
        void budgetNeverExceeded() {
            executor.defaultBehaviour(t -> {
                sleep(20);
                return TaskResult.success("", "", 20);
            });
            var tasks = new ArrayList<Task>();
            for (int i = 0; i < 6; i++) {
                tasks.add(task("T" + i, List.of(), List.of("/out" + i), 2));
            }

            var budget = new ResourceBudget(4, 0);
            var outcome = run(tasks, budget, FailurePolicy.FAIL_FAST);

            assertTrue(outcome.succeeded());
            assertTrue(executor.peakCpus() <= 4, "peak was " + executor.peakCpus());
            assertEquals(0, budget.usedCpus());
        }

        @Test
        @DisplayName("concurrent memory use never exceeds the budget")
        void memoryBudgetNeverExceeded() {
            executor.defaultBehaviour(t -> {
                sleep(20);
                return TaskResult.success("", "", 20);
            });
            var tasks = new ArrayList<Task>();
            for (int i = 0; i < 6; i++) {
                tasks.add(task("T" + i, List.of(), List.of("/out" + i), 1, 100));
            }

            var budget = new ResourceBudget(0, 250);
            var outcome = run(tasks, budget, FailurePolicy.FAIL_FAST);

            assertTrue(outcome.succeeded());
            assertTrue(executor.peakMemoryMb() <= 250, "peak was " + executor.peakMemoryMb() + "MB");
            assertEquals(0, budget.usedMemoryMb());
        }

        @Test
        @DisplayName("a smaller ready task is admitted when a larger one does not fit")
        void firstFitAdmission() {
            var smallStarted = new CountDownLatch(1);
            executor.behave("big1", t -> await(smallStarted)
                    ? TaskResult.success("", "", 1)
                    : TaskResult.error("small task never started", 1));
            executor.behave("small", t -> {
                smallStarted.countDown();
                return TaskResult.success("", "", 1);
            });

            var tasks = List.of(
                    task("big1", List.of(), List.of("/1"), 3),
                    task("big2", List.of(), List.of("/2"), 3),
                    task("small", List.of(), List.of("/3"), 1));

            var outcome = run(tasks, new ResourceBudget(4, 0), FailurePolicy.FAIL_FAST);

            assertTrue(outcome.succeeded(), () -> "outcome: " + outcome.states());
            var timeline = executor.timeline();
            assertTrue(timeline.indexOf("start:small") < timeline.indexOf("end:big1"));
            assertTrue(timeline.indexOf("end:big1") < timeline.indexOf("start:big2"));
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureTests {

        @Test
        @DisplayName("dependents of a failed task are skipped and never executed")
        void cascadingSkip() {
            executor.behave("A", t -> TaskResult.exited(3, "", "boom", 1));
            var tasks = List.of(
                    task("A", List.of(), List.of("/a")),
                    task("B", List.of("/a"), List.of("/b")),
                    task("C", List.of("/b"), List.of("/c")));

            var outcome = run(tasks, ResourceBudget.unlimited(), FailurePolicy.CONTINUE);

            assertFalse(outcome.succeeded());
            assertEquals(TaskState.FAILED, outcome.stateOf("A"));
            assertEquals(TaskState.SKIPPED, outcome.stateOf("B"));
            assertEquals(TaskState.SKIPPED, outcome.stateOf("C"));
            assertEquals(FailureReason.TASK_EXECUTION_FAILED, outcome.failureReason("A"));
            assertFalse(executor.timeline().contains("start:B"));
        }

        @Test
        @DisplayName("FAIL_FAST starts nothing new after a failure")
        void failFastSkipsIndependentTasks() {
            executor.behave("A", t -> TaskResult.exited(1, "", "", 1));
            var tasks = List.of(
                    task("A", List.of(), List.of("/a")),
                    task("C", List.of(), List.of("/c")));

            var outcome = run(tasks, new ResourceBudget(1, 0), FailurePolicy.FAIL_FAST);

            assertEquals(TaskState.FAILED, outcome.stateOf("A"));
            assertEquals(TaskState.SKIPPED, outcome.stateOf("C"));
            assertEquals(List.of("C"), outcome.skippedTasks());
        }

        @Test
        @DisplayName("CONTINUE keeps running independent branches")
        void continueRunsIndependentTasks() {
            executor.behave("A", t -> TaskResult.exited(1, "", "", 1));
            var tasks = List.of(
                    task("A", List.of(), List.of("/a")),
                    task("B", List.of("/a"), List.of("/b")),
                    task("C", List.of(), List.of("/c")));

            var outcome = run(tasks, new ResourceBudget(1, 0), FailurePolicy.CONTINUE);

            assertEquals(TaskState.FAILED, outcome.stateOf("A"));
            assertEquals(TaskState.SKIPPED, outcome.stateOf("B"));
            assertEquals(TaskState.SUCCEEDED, outcome.stateOf("C"));
        }

        @Test
        @DisplayName("CANCEL terminates running tasks")
        void cancelTerminatesRunningTasks() {
            var bStarted = new CountDownLatch(1);
            executor.behave("A", t -> {
                await(bStarted);
                return TaskResult.exited(1, "", "", 1);
            });
            executor.behave("B", t -> {
                bStarted.countDown();
                return executor.awaitCancel(t);
            });
            var tasks = List.of(
                    task("A", List.of(), List.of("/a")),
                    task("B", List.of(), List.of("/b")),
                    task("D", List.of("/b"), List.of("/d")));

            var outcome = run(tasks, ResourceBudget.unlimited(), FailurePolicy.CANCEL);

            assertEquals(TaskState.FAILED, outcome.stateOf("A"));
            assertEquals(TaskState.CANCELLED, outcome.stateOf("B"));
            assertEquals(TaskState.SKIPPED, outcome.stateOf("D"));
            assertTrue(executor.cancelled().contains("B"));
            assertFalse(outcome.succeeded());
        }

        @Test
        @DisplayName("an executor exception becomes a RUNTIME_ERROR failure")
        void executorExceptionIsAFailure() {
            executor.behave("A", t -> {
                throw new IllegalStateException("backend down");
            });
            var tasks = List.of(task("A", List.of(), List.of("/a")));

            var outcome = run(tasks, ResourceBudget.unlimited(), FailurePolicy.FAIL_FAST);

            assertEquals(TaskState.FAILED, outcome.stateOf("A"));
            assertEquals(FailureReason.RUNTIME_ERROR, outcome.failureReason("A"));
            assertEquals("backend down", outcome.results().get("A").stderrSummary());
        }

        @Test
        @DisplayName("run timeout cancels running tasks and skips the rest")
        void runTimeout() {
            executor.behave("A", executor::awaitCancel);
            var tasks = List.of(
                    task("A", List.of(), List.of("/a")),
                    task("B", List.of("/a"), List.of("/b")));

            var outcome = run(tasks, ResourceBudget.unlimited(), FailurePolicy.FAIL_FAST, Duration.ofMillis(200));

            assertTrue(outcome.timedOut());
            assertFalse(outcome.succeeded());
            assertEquals(TaskState.CANCELLED, outcome.stateOf("A"));
            assertEquals(TaskState.SKIPPED, outcome.stateOf("B"));
        }
    }

    @Nested
    @DisplayName("Events")
    class EventTests {

        @Test
        @DisplayName("publishes task lifecycle events for the run")
        void publishesLifecycleEvents() {
            List<FlowEvent> events = Collections.synchronizedList(new ArrayList<>());
            eventBus.subscribe("RUN-1", events::add);
            executor.behave("A", t -> TaskResult.exited(2, "", "", 1));
            var tasks = List.of(
                    task("A", List.of(), List.of("/a")),
                    task("B", List.of("/a"), List.of("/b")));

            run(tasks, ResourceBudget.unlimited(), FailurePolicy.FAIL_FAST);

            var types = events.stream().map(e -> e.eventType() + ":" + e.taskId()).toList();
            assertEquals(List.of("task.started:A", "task.failed:A", "task.skipped:B"), types);
            assertEquals(2, events.get(1).payload().get("exitCode"));
        }
    }

    private static boolean await(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Test double that records start/end order and concurrent CPU use.
     */
    static class RecordingExecutor implements TaskExecutor {

        private final List<String> timeline = Collections.synchronizedList(new ArrayList<>());
        private final Map<String, Function<Task, TaskResult>> behaviours = new ConcurrentHashMap<>();
        private final Map<String, CountDownLatch> cancelLatches = new ConcurrentHashMap<>();
        private final Set<String> cancelled = ConcurrentHashMap.newKeySet();
        private final AtomicInteger cpusInUse = new AtomicInteger();
        private final AtomicInteger peakCpus = new AtomicInteger();
        private final AtomicInteger memoryInUse = new AtomicInteger();
        private final AtomicInteger peakMemory = new AtomicInteger();
        private volatile Function<Task, TaskResult> defaultBehaviour = t -> TaskResult.success("ok", "", 1);

        void behave(String taskId, Function<Task, TaskResult> behaviour) {
            behaviours.put(taskId, behaviour);
        }

        void defaultBehaviour(Function<Task, TaskResult> behaviour) {
            this.defaultBehaviour = behaviour;
        }

        /** Blocks until the task is cancelled, then reports it killed. */
        TaskResult awaitCancel(Task task) {
            var latch = cancelLatches.computeIfAbsent(task.id(), k -> new CountDownLatch(1));
            return await(latch)
                    ? TaskResult.exited(137, "", "killed", 1)
                    : TaskResult.error("never cancelled", 1);
        }

        @Override
        public TaskResult execute(String runId, Task task) {
            int now = cpusInUse.addAndGet(task.resources().cpus());
            peakCpus.accumulateAndGet(now, Math::max);
            peakMemory.accumulateAndGet(memoryInUse.addAndGet(task.resources().memoryMb()), Math::max);
            timeline.add("start:" + task.id());
            try {
                return behaviours.getOrDefault(task.id(), defaultBehaviour).apply(task);
            } finally {
                timeline.add("end:" + task.id());
                cpusInUse.addAndGet(-task.resources().cpus());
                memoryInUse.addAndGet(-task.resources().memoryMb());
            }
        }

        @Override
        public void cancel(String runId, Task task) {
            cancelled.add(task.id());
            cancelLatches.computeIfAbsent(task.id(), k -> new CountDownLatch(1)).countDown();
        }

        List<String> timeline() {
            synchronized (timeline) {
                return List.copyOf(timeline);
            }
        }

        Set<String> cancelled() {
            return cancelled;
        }

        int peakCpus() {
            return peakCpus.get();
        }

        int peakMemoryMb() {
            return peakMemory.get();
        }
    }
}
