package com.flow.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * A single unit of work within a workflow, executed inside a container.
 *
 * <p>Paths are expected to be absolute by the time a task reaches the graph builder;
 * they are compared as plain strings.
 *
 * @param id           unique identifier within one run (e.g. "bwa-1")
 * @param analysisName name used for resource lookup and diagnostics, not necessarily unique
 * @param command      command line passed verbatim to the container
 * @param inputs       absolute paths this task reads
 * @param outputs      absolute paths this task writes
 * @param resources    compute requirement
 */
public record Task(
    String id,
    String analysisName,
    String command,
    List<String> inputs,
    List<String> outputs,
    Resources resources
) implements Serializable {

    public Task {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(analysisName, "analysisName");
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }

    public Task withResources(Resources resources) {
        return new Task(id, analysisName, command, inputs, outputs, resources);
    }
}
