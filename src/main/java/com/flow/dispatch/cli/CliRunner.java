package com.flow.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final FlowCommand flowCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(FlowCommand flowCommand, IFactory factory) {
        this.flowCommand = flowCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        exitCode = new CommandLine(flowCommand, factory).execute(commandArgs(args));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Drops {@code --flow.x=y} style property overrides, which Spring Boot has
     * already bound, so picocli only sees its own arguments.
     */
    static String[] commandArgs(String... args) {
        return Arrays.stream(args)
                .filter(arg -> !isPropertyOverride(arg))
                .toArray(String[]::new);
    }

    private static boolean isPropertyOverride(String arg) {
        return arg.startsWith("--flow.") || arg.startsWith("--spring.") || arg.startsWith("--logging.");
    }
}
