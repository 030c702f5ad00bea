package com.flow.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tasks through the Singularity CLI on the local host.
 *
 * <p>This class shells out via {@link ProcessBuilder}:
 * {@code singularity exec <extra args> --bind <dir> ... <container> /bin/sh -c <command>}.
 * Stdout and stderr are redirected to temporary files that live until teardown.
 */
public class SingularitySandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(SingularitySandboxProvider.class);

    private final String singularityBin;
    private final AtomicInteger counter = new AtomicInteger();
    private final Map<String, RunningProcess> processes = new ConcurrentHashMap<>();

    private record RunningProcess(Process process, Path stdoutFile, Path stderrFile) {}

    public SingularitySandboxProvider(String singularityBin) {
        this.singularityBin = singularityBin;
    }

    @Override
    public String openSandbox(SandboxRequest request) {
        var command = buildCommand(singularityBin, request);
        String sandboxId = "singularity-" + request.taskId() + "-" + counter.incrementAndGet();
        log.info("Opening sandbox {} for task {} (container: {})",
                sandboxId, request.taskId(), request.containerRef());
        log.debug("Running: {}", String.join(" ", command));

        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            stdoutFile = Files.createTempFile("flow-" + request.taskId() + "-", ".out");
            stderrFile = Files.createTempFile("flow-" + request.taskId() + "-", ".err");
            var process = new ProcessBuilder(command)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile())
                    .start();
            processes.put(sandboxId, new RunningProcess(process, stdoutFile, stderrFile));
            return sandboxId;
        } catch (IOException e) {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
            throw new IllegalStateException("Failed to start " + singularityBin + " for task " + request.taskId(), e);
        }
    }

    @Override
    public int waitForCompletion(String sandboxId, int timeoutSeconds) {
        var running = processes.get(sandboxId);
        if (running == null) {
            log.warn("Unknown or already torn down sandbox {}", sandboxId);
            return -1;
        }
        try {
            if (!running.process().waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                throw new SandboxTimeoutException(sandboxId, timeoutSeconds);
            }
            return running.process().exitValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for sandbox {}", sandboxId);
            return -1;
        }
    }

    @Override
    public CapturedOutput captureOutput(String sandboxId) {
        var running = processes.get(sandboxId);
        if (running == null) {
            return CapturedOutput.EMPTY;
        }
        return new CapturedOutput(read(running.stdoutFile()), read(running.stderrFile()));
    }

    @Override
    public void teardownSandbox(String sandboxId) {
        var running = processes.remove(sandboxId);
        if (running == null) {
            return;
        }
        Process process = running.process();
        if (process.isAlive()) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            log.info("Sandbox {} killed", sandboxId);
        }
        deleteQuietly(running.stdoutFile());
        deleteQuietly(running.stderrFile());
    }

    @Override
    public boolean isAvailable() {
        try {
            var process = new ProcessBuilder(singularityBin, "--version")
                    .redirectErrorStream(true)
                    .start();
            if (!process.waitFor(10, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return false;
            }
            return process.exitValue() == 0;
        } catch (IOException e) {
            log.warn("{} not runnable: {}", singularityBin, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public String name() {
        return "singularity";
    }

    /**
     * Assembles the full command line for one task.
     */
    static List<String> buildCommand(String singularityBin, SandboxRequest request) {
        var command = new ArrayList<String>();
        command.add(singularityBin);
        command.add("exec");
        String extra = request.extraRuntimeArgs().strip();
        if (!extra.isEmpty()) {
            command.addAll(Arrays.asList(extra.split("\\s+")));
        }
        for (String dir : request.bindPaths()) {
            command.add("--bind");
            command.add(dir);
        }
        command.add(request.containerRef());
        command.add("/bin/sh");
        command.add("-c");
        command.add(request.command());
        return command;
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return "";
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not clean up {}", file);
        }
    }
}
