package com.flow.core.workflow;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk form of a workflow: optional per-analysis resources and the task list.
 */
public record WorkflowDefinition(
    @JsonProperty("resources") Map<String, ResourceEntry> resources,
    @JsonProperty("tasks") List<TaskEntry> tasks
) {
    public WorkflowDefinition {
        resources = resources != null ? Collections.unmodifiableMap(new LinkedHashMap<>(resources)) : Map.of();
        tasks = tasks != null ? Collections.unmodifiableList(new ArrayList<>(tasks)) : List.of();
    }

    /**
     * Resource requirement of one analysis. Memory in MB, time in minutes.
     */
    public record ResourceEntry(
        @JsonProperty("cpus") int cpus,
        @JsonProperty("memory") int memory,
        @JsonProperty("time") int time,
        @JsonProperty("container") String container,
        @JsonProperty("extra-args") String extraArgs
    ) {}

    public record TaskEntry(
        @JsonProperty("analysis") String analysis,
        @JsonProperty("id") String id,
        @JsonProperty("command") String command,
        @JsonProperty("inputs") List<String> inputs,
        @JsonProperty("outputs") List<String> outputs
    ) {}
}
