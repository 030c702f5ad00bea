package com.flow.dispatch.cli;

import com.flow.core.engine.RunController;
import com.flow.core.events.EventBus;
import com.flow.core.events.FlowEvent;
import com.flow.core.graph.CyclicDependencyException;
import com.flow.core.graph.DependencyGraphBuilder;
import com.flow.core.health.HealthCheckService;
import com.flow.core.health.HealthStatus;
import com.flow.core.model.Resources;
import com.flow.core.model.RunOutcome;
import com.flow.core.model.Task;
import com.flow.core.model.TaskResult;
import com.flow.core.model.TaskState;
import com.flow.core.workflow.WorkflowDefinitionException;
import com.flow.core.workflow.WorkflowDefinitionLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the Flow CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, and execution behavior.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static final Resources RES = new Resources(1, 512, 10, "docker://tools");

    private WorkflowDefinitionLoader loader;
    private RunController runController;
    private EventBus eventBus;
    private HealthCheckService healthCheckService;

    private final List<Task> tasks = List.of(
            new Task("align", "bwa", "bwa mem", List.of("/d/in.fq"), List.of("/d/out.sam"), RES),
            new Task("sort-1", "sort", "samtools sort", List.of("/d/out.sam"), List.of("/d/out.bam"), RES));

    @BeforeEach
    void setUp() {
        loader = mock(WorkflowDefinitionLoader.class);
        runController = mock(RunController.class);
        eventBus = new EventBus();
        healthCheckService = mock(HealthCheckService.class);
        when(runController.generateRunId()).thenReturn("FLOW-20261018-120000-0001");
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(loader, runController, eventBus);
                }
                if (cls == ValidateCommand.class) {
                    return (K) new ValidateCommand(loader, runController);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new FlowCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private RunOutcome outcome(TaskState alignState, TaskState sortState, TaskResult alignResult) {
        var states = new LinkedHashMap<String, TaskState>();
        states.put("align", alignState);
        states.put("sort-1", sortState);
        var results = new LinkedHashMap<String, TaskResult>();
        results.put("align", alignResult);
        return new RunOutcome("FLOW-20261018-120000-0001", states, results, false, 1500);
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("run"));
            assertTrue(result.output().contains("validate"));
            assertTrue(result.output().contains("health"));
        }

        @Test
        @DisplayName("no arguments prints usage")
        void noArgumentsPrintsUsage() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Usage: flow"));
        }

        @Test
        @DisplayName("--version prints the version")
        void versionFlag() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Flow 0.1.0"));
        }

        @Test
        @DisplayName("run without a workflow is a usage error")
        void runRequiresWorkflow() {
            CliResult result = execute("run");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }
    }

    // =====================================================================
    //  run
    // =====================================================================

    @Nested
    @DisplayName("run command")
    class RunTests {

        @Test
        @DisplayName("successful run exits 0 and prints every task state")
        void successfulRun() {
            when(loader.load(Path.of("wf.yml"))).thenReturn(tasks);
            when(runController.run(eq("FLOW-20261018-120000-0001"), anyList())).thenReturn(
                    outcome(TaskState.SUCCEEDED, TaskState.SUCCEEDED, TaskResult.success("", "", 10)));

            CliResult result = execute("run", "wf.yml");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SUCCEEDED align"));
            assertTrue(result.output().contains("SUCCEEDED sort-1"));
            assertTrue(result.output().contains("Run succeeded"));
        }

        @Test
        @DisplayName("failed task exits 1 and shows its last stderr line")
        void failedRun() {
            when(loader.load(any(Path.class))).thenReturn(tasks);
            when(runController.run(eq("FLOW-20261018-120000-0001"), anyList())).thenReturn(
                    outcome(TaskState.FAILED, TaskState.SKIPPED,
                            TaskResult.exited(1, "", "loading index\n[E::bwa_idx_load] fail to locate the index", 10)));

            CliResult result = execute("run", "wf.yml");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("FAILED"));
            assertTrue(result.output().contains("sort-1"));
            assertTrue(result.output().contains("[E::bwa_idx_load] fail to locate the index"));
            assertTrue(result.output().contains("1 failed"));
        }

        @Test
        @DisplayName("rejected workflow exits 1 without running")
        void rejectedWorkflow() {
            when(loader.load(any(Path.class))).thenReturn(tasks);
            when(runController.run(any(), anyList()))
                    .thenThrow(new CyclicDependencyException(List.of("align", "sort-1")));

            CliResult result = execute("run", "wf.yml");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Workflow rejected"));
        }

        @Test
        @DisplayName("unreadable workflow exits 1")
        void unreadableWorkflow() {
            when(loader.load(any(Path.class)))
                    .thenThrow(new WorkflowDefinitionException("workflow file not found: wf.yml"));

            CliResult result = execute("run", "wf.yml");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("workflow file not found"));
        }

        @Test
        @DisplayName("empty workflow exits 0")
        void emptyWorkflow() {
            when(loader.load(any(Path.class))).thenReturn(List.of());
            when(runController.run(any(), anyList()))
                    .thenReturn(RunOutcome.empty("FLOW-20261018-120000-0001"));

            CliResult result = execute("run", "wf.yml");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Nothing to do"));
        }

        @Test
        @DisplayName("--watch prints task events for this run")
        void watchPrintsEvents() {
            when(loader.load(any(Path.class))).thenReturn(tasks);
            when(runController.run(eq("FLOW-20261018-120000-0001"), anyList())).thenAnswer(inv -> {
                eventBus.publish(FlowEvent.of("task.started", "FLOW-20261018-120000-0001", "align", Map.of()));
                eventBus.publish(FlowEvent.of("task.started", "FLOW-OTHER", "elsewhere", Map.of()));
                return outcome(TaskState.SUCCEEDED, TaskState.SUCCEEDED, TaskResult.success("", "", 10));
            });

            CliResult result = execute("run", "--watch", "wf.yml");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("[START] align"));
            assertFalse(result.output().contains("elsewhere"));
        }
    }

    // =====================================================================
    //  validate and health
    // =====================================================================

    @Nested
    @DisplayName("validate command")
    class ValidateTests {

        @Test
        @DisplayName("valid workflow prints dependencies and exits 0")
        void validWorkflow() {
            when(loader.load(any(Path.class))).thenReturn(tasks);
            when(runController.plan(tasks)).thenReturn(new DependencyGraphBuilder().build(tasks));

            CliResult result = execute("validate", "wf.yml");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("sort-1 [sort]  <- align"));
            assertTrue(result.output().contains("Workflow valid: 2 tasks, 1 dependencies"));
        }

        @Test
        @DisplayName("invalid workflow exits 1")
        void invalidWorkflow() {
            when(loader.load(any(Path.class))).thenReturn(tasks);
            when(runController.plan(tasks)).thenThrow(new CyclicDependencyException(List.of("align", "sort-1")));

            assertEquals(1, execute("validate", "wf.yml").exitCode());
        }
    }

    @Nested
    @DisplayName("health command")
    class HealthTests {

        @Test
        @DisplayName("all components UP exits 0")
        void allUp() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("runner", HealthStatus.Status.UP, "docker available", Map.of()),
                    new HealthStatus("flowdir", HealthStatus.Status.UP, ".flow writable", Map.of())));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("all systems operational"));
        }

        @Test
        @DisplayName("any component DOWN exits 1")
        void componentDown() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("runner", HealthStatus.Status.DOWN, "singularity not reachable", Map.of())));

            CliResult result = execute("health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("runner: singularity not reachable"));
        }
    }

    @Test
    @DisplayName("property overrides are not passed to picocli")
    void propertyOverridesAreFiltered() {
        assertArrayEquals(new String[]{"run", "wf.yml"},
                CliRunner.commandArgs("--flow.job-runner=docker", "run", "--logging.level.root=DEBUG", "wf.yml"));
    }

    @Test
    @DisplayName("durations are formatted for humans")
    void formatDuration() {
        assertEquals("950ms", ConsoleOutput.formatDuration(950));
        assertEquals("42s", ConsoleOutput.formatDuration(42_000));
        assertEquals("2m 5s", ConsoleOutput.formatDuration(125_000));
    }
}
