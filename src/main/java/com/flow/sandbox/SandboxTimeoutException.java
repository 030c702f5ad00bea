package com.flow.sandbox;

/**
 * Thrown by {@link SandboxProvider#waitForCompletion} when a container outlives its time limit.
 */
public class SandboxTimeoutException extends RuntimeException {

    private final String sandboxId;
    private final int timeoutSeconds;

    public SandboxTimeoutException(String sandboxId, int timeoutSeconds) {
        super("sandbox " + sandboxId + " still running after " + timeoutSeconds + "s");
        this.sandboxId = sandboxId;
        this.timeoutSeconds = timeoutSeconds;
    }

    public String sandboxId() { return sandboxId; }
    public int timeoutSeconds() { return timeoutSeconds; }
}
