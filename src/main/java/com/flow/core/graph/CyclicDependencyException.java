package com.flow.core.graph;

import com.flow.core.validation.WorkflowValidationException;

import java.util.List;

/**
 * Thrown when the inferred dependencies form a cycle.
 */
public class CyclicDependencyException extends WorkflowValidationException {

    private final List<String> cycle;

    /**
     * @param cycle task ids along the cycle, in dependency order
     */
    public CyclicDependencyException(List<String> cycle) {
        super("the workflow has cyclic dependencies: " + String.join(" -> ", cycle) + " -> " + cycle.get(0));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
