package com.flow.core.graph;

import com.flow.core.model.Task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Immutable dependency graph over the tasks of one run.
 *
 * <p>Tasks are numbered by vertex in workflow order. Adjacency lists are sorted
 * ascending, which keeps traversal order deterministic.
 */
public final class TaskGraph {

    private final List<Task> tasks;
    private final Map<String, Integer> vertexById;
    private final List<List<Integer>> predecessors;
    private final List<List<Integer>> successors;

    TaskGraph(List<Task> tasks, Map<String, Integer> vertexById,
              List<List<Integer>> predecessors, List<List<Integer>> successors) {
        this.tasks = List.copyOf(tasks);
        this.vertexById = Map.copyOf(vertexById);
        this.predecessors = freeze(predecessors);
        this.successors = freeze(successors);
    }

    private static List<List<Integer>> freeze(List<List<Integer>> adjacency) {
        var frozen = new ArrayList<List<Integer>>(adjacency.size());
        for (var list : adjacency) {
            frozen.add(List.copyOf(list));
        }
        return Collections.unmodifiableList(frozen);
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    public List<Task> tasks() {
        return tasks;
    }

    public Task task(int vertex) {
        return tasks.get(vertex);
    }

    public int vertexOf(String taskId) {
        Integer v = vertexById.get(taskId);
        if (v == null) {
            throw new IllegalArgumentException("No task with id [" + taskId + "]");
        }
        return v;
    }

    /** Vertices this vertex depends on. */
    public List<Integer> predecessors(int vertex) {
        return predecessors.get(vertex);
    }

    /** Vertices depending on this vertex. */
    public List<Integer> successors(int vertex) {
        return successors.get(vertex);
    }

    public List<Edge> edges() {
        var edges = new ArrayList<Edge>();
        for (int u = 0; u < tasks.size(); u++) {
            for (int v : successors.get(u)) {
                edges.add(new Edge(tasks.get(u), tasks.get(v)));
            }
        }
        return edges;
    }

    /** Ids of the tasks the given task depends on. */
    public List<String> dependenciesOf(String taskId) {
        return predecessors(vertexOf(taskId)).stream().map(v -> tasks.get(v).id()).toList();
    }

    /** Ids of the tasks depending on the given task. */
    public List<String> dependentsOf(String taskId) {
        return successors(vertexOf(taskId)).stream().map(v -> tasks.get(v).id()).toList();
    }

    @Override
    public String toString() {
        return String.format("TaskGraph [tasks=%d, edges=%s]", tasks.size(), edges());
    }
}
