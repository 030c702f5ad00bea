package com.flow.core.model;

import java.io.Serializable;

/**
 * Compute requirement of a single task.
 *
 * <p>A field that the configuration did not supply is carried as {@code 0} (numbers)
 * or {@code null} (container) so that
 * {@link com.flow.core.validation.ResourceValidator} can name it.
 *
 * @param cpus             CPU count
 * @param memoryMb         memory limit in MB
 * @param timeLimitMinutes wall-clock limit in minutes
 * @param containerRef     container image reference, e.g. "docker://bwa:0.7.17"
 * @param extraRuntimeArgs additional arguments for the container runtime (may be empty)
 */
public record Resources(
    int cpus,
    int memoryMb,
    int timeLimitMinutes,
    String containerRef,
    String extraRuntimeArgs
) implements Serializable {

    public Resources {
        extraRuntimeArgs = extraRuntimeArgs != null ? extraRuntimeArgs : "";
    }

    public Resources(int cpus, int memoryMb, int timeLimitMinutes, String containerRef) {
        this(cpus, memoryMb, timeLimitMinutes, containerRef, "");
    }
}
