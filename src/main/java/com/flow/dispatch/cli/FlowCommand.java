package com.flow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Flow.
 * Routes to subcommands: run, validate, health.
 */
@Command(
        name = "flow",
        mixinStandardHelpOptions = true,
        version = "Flow 0.1.0",
        description = "Runs workflows of containerized analysis tasks",
        footer = "Configuration can be overridden with --flow.<key>=<value>, e.g. --flow.budget.cpus=16",
        subcommands = {
                RunCommand.class,
                ValidateCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FlowCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
