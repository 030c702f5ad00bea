package com.flow.dispatch.cli;

import com.flow.core.engine.RunController;
import com.flow.core.events.EventBus;
import com.flow.core.model.RunOutcome;
import com.flow.core.model.Task;
import com.flow.core.validation.WorkflowValidationException;
import com.flow.core.workflow.WorkflowDefinitionException;
import com.flow.core.workflow.WorkflowDefinitionLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: flow run &lt;workflow&gt;
 * <p>
 * Loads a workflow file, executes every task and prints the final state of each.
 * Exits with 1 when the workflow is rejected or any task fails.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a workflow")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow definition (YAML or JSON)")
    private Path workflow;

    @Option(names = {"--watch", "-w"}, description = "Print task events as they happen")
    private boolean watch;

    private final WorkflowDefinitionLoader loader;
    private final RunController runController;
    private final EventBus eventBus;

    public RunCommand(WorkflowDefinitionLoader loader, RunController runController, EventBus eventBus) {
        this.loader = loader;
        this.runController = runController;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<Task> tasks;
        try {
            tasks = loader.load(workflow);
        } catch (WorkflowDefinitionException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        String runId = runController.generateRunId();
        ConsoleOutput.info("Run " + runId + ": " + tasks.size() + " tasks from " + workflow);

        EventBus.Subscription subscription = watch
                ? eventBus.subscribe(runId, ConsoleOutput::event)
                : null;
        RunOutcome outcome;
        try {
            outcome = runController.run(runId, tasks);
        } catch (WorkflowValidationException e) {
            ConsoleOutput.error("Workflow rejected: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            ConsoleOutput.error("Run failed: " + rootCauseMessage(e));
            return 1;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        if (tasks.isEmpty()) {
            ConsoleOutput.info("Nothing to do");
            return 0;
        }
        ConsoleOutput.outcome(outcome);
        if (outcome.succeeded()) {
            ConsoleOutput.success("Run succeeded");
            return 0;
        }
        ConsoleOutput.error("Run failed");
        return 1;
    }

    static String rootCauseMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
