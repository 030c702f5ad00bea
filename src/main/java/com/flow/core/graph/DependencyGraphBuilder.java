package com.flow.core.graph;

import com.flow.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Builds a {@link TaskGraph} by matching declared outputs against declared inputs.
 *
 * <p>Paths are compared as exact strings: two spellings of the same file are two
 * different dependencies. An input no task produces is an external file and adds no
 * edge. The builder does no I/O.
 */
@Service
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private static final int WHITE = 0;
    private static final int GREY = 1;
    private static final int BLACK = 2;

    /**
     * @param tasks validated tasks in workflow order
     * @return the acyclic dependency graph
     * @throws DuplicateTaskException     if two tasks share an id
     * @throws AmbiguousProducerException if two tasks declare the same output
     * @throws CyclicDependencyException  if the dependencies form a cycle
     */
    public TaskGraph build(List<Task> tasks) {
        int n = tasks.size();

        var vertexById = new HashMap<String, Integer>();
        for (int v = 0; v < n; v++) {
            if (vertexById.putIfAbsent(tasks.get(v).id(), v) != null) {
                throw new DuplicateTaskException(tasks.get(v).id());
            }
        }

        // output path -> producing vertex
        var producers = new HashMap<String, Integer>();
        for (int v = 0; v < n; v++) {
            for (String path : tasks.get(v).outputs()) {
                Integer previous = producers.putIfAbsent(path, v);
                if (previous != null && previous != v) {
                    throw new AmbiguousProducerException(path, tasks.get(previous).id(), tasks.get(v).id());
                }
            }
        }

        var predecessorSets = new ArrayList<TreeSet<Integer>>(n);
        var successorSets = new ArrayList<TreeSet<Integer>>(n);
        for (int v = 0; v < n; v++) {
            predecessorSets.add(new TreeSet<>());
            successorSets.add(new TreeSet<>());
        }

        int external = 0;
        for (int v = 0; v < n; v++) {
            for (String path : tasks.get(v).inputs()) {
                Integer u = producers.get(path);
                if (u == null) {
                    external++;
                    continue;
                }
                predecessorSets.get(v).add(u);
                successorSets.get(u).add(v);
            }
        }

        var predecessors = new ArrayList<List<Integer>>(n);
        var successors = new ArrayList<List<Integer>>(n);
        for (int v = 0; v < n; v++) {
            predecessors.add(new ArrayList<>(predecessorSets.get(v)));
            successors.add(new ArrayList<>(successorSets.get(v)));
        }

        List<Integer> cycle = findCycle(successors);
        if (!cycle.isEmpty()) {
            throw new CyclicDependencyException(cycle.stream().map(v -> tasks.get(v).id()).toList());
        }

        var graph = new TaskGraph(tasks, vertexById, predecessors, successors);
        log.debug("Built dependency graph: {} tasks, {} edges, {} external inputs",
                n, graph.edges().size(), external);
        return graph;
    }

    /**
     * Depth-first search with white/grey/black colouring. Returns the vertices of the
     * first cycle found in dependency order, or an empty list.
     */
    private static List<Integer> findCycle(List<List<Integer>> successors) {
        int n = successors.size();
        int[] colour = new int[n];
        int[] parent = new int[n];

        for (int root = 0; root < n; root++) {
            if (colour[root] != WHITE) continue;

            // Iterative DFS: stack holds {vertex, next successor index}
            Deque<int[]> stack = new ArrayDeque<>();
            stack.push(new int[]{root, 0});
            colour[root] = GREY;
            parent[root] = -1;

            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                int u = frame[0];
                List<Integer> next = successors.get(u);
                if (frame[1] < next.size()) {
                    int v = next.get(frame[1]++);
                    if (colour[v] == GREY) {
                        return unwind(parent, u, v);
                    }
                    if (colour[v] == WHITE) {
                        colour[v] = GREY;
                        parent[v] = u;
                        stack.push(new int[]{v, 0});
                    }
                } else {
                    colour[u] = BLACK;
                    stack.pop();
                }
            }
        }
        return List.of();
    }

    /** Walks parent links from {@code u} back to {@code v}, the grey vertex that closes the cycle. */
    private static List<Integer> unwind(int[] parent, int u, int v) {
        var cycle = new ArrayList<Integer>();
        for (int w = u; w != v; w = parent[w]) {
            cycle.add(w);
        }
        cycle.add(v);
        Collections.reverse(cycle);
        return cycle;
    }
}
