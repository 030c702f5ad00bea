package com.flow.sandbox;

/**
 * Abstraction for container execution backends.
 * Implementations: SingularitySandboxProvider (default), DockerSandboxProvider.
 */
public interface SandboxProvider {

    /**
     * Creates and starts a container for a task.
     * @return the container/sandbox ID
     */
    String openSandbox(SandboxRequest request);

    /**
     * Blocks until the container exits.
     * @return the container exit code (0 = success, -1 when none could be observed)
     * @throws SandboxTimeoutException if the container is still running after {@code timeoutSeconds}
     */
    int waitForCompletion(String sandboxId, int timeoutSeconds);

    /**
     * Captures stdout/stderr from the container.
     */
    CapturedOutput captureOutput(String sandboxId);

    /**
     * Stops and removes the container. Safe to call more than once.
     */
    void teardownSandbox(String sandboxId);

    /**
     * Whether the backend is reachable, e.g. the daemon answers or the binary runs.
     */
    boolean isAvailable();

    /**
     * Short backend name for diagnostics.
     */
    String name();
}
