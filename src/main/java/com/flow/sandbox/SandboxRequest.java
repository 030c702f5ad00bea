package com.flow.sandbox;

import java.util.List;

/**
 * Everything a backend needs to start one task's container.
 *
 * @param runId            run the task belongs to
 * @param taskId           unique task identifier
 * @param containerRef     image reference as configured (e.g. "docker://bwa:0.7.17")
 * @param command          shell command run inside the container
 * @param cpus             CPU limit
 * @param memoryMb         memory limit in MB
 * @param bindPaths        host directories mounted at the same path inside the container
 * @param extraRuntimeArgs additional runtime arguments, may be empty
 */
public record SandboxRequest(
    String runId,
    String taskId,
    String containerRef,
    String command,
    int cpus,
    int memoryMb,
    List<String> bindPaths,
    String extraRuntimeArgs
) {
    public SandboxRequest {
        bindPaths = bindPaths != null ? List.copyOf(bindPaths) : List.of();
        extraRuntimeArgs = extraRuntimeArgs != null ? extraRuntimeArgs : "";
    }
}
