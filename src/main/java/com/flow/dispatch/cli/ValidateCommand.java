package com.flow.dispatch.cli;

import com.flow.core.engine.RunController;
import com.flow.core.graph.TaskGraph;
import com.flow.core.validation.WorkflowValidationException;
import com.flow.core.workflow.WorkflowDefinitionException;
import com.flow.core.workflow.WorkflowDefinitionLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: flow validate &lt;workflow&gt;
 * <p>
 * Checks resources and dependencies without running anything, then prints each
 * task with the tasks it depends on.
 */
@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Check a workflow and show its dependency graph")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow definition (YAML or JSON)")
    private Path workflow;

    private final WorkflowDefinitionLoader loader;
    private final RunController runController;

    public ValidateCommand(WorkflowDefinitionLoader loader, RunController runController) {
        this.loader = loader;
        this.runController = runController;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        TaskGraph graph;
        try {
            graph = runController.plan(loader.load(workflow));
        } catch (WorkflowDefinitionException | WorkflowValidationException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        for (var task : graph.tasks()) {
            var deps = graph.dependenciesOf(task.id());
            String suffix = deps.isEmpty() ? "" : "  <- " + String.join(", ", deps);
            System.out.println("  " + task.id() + " [" + task.analysisName() + "]" + suffix);
        }
        ConsoleOutput.success(String.format("Workflow valid: %d tasks, %d dependencies",
                graph.size(), graph.edges().size()));
        return 0;
    }
}
