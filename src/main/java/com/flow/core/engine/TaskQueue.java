package com.flow.core.engine;

import com.flow.core.config.ResourceCatalog;
import com.flow.core.model.Resources;
import com.flow.core.model.RunOutcome;
import com.flow.core.model.Task;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects tasks for a single run and hands them to the {@link RunController}.
 *
 * <p>Fills in what the author may leave out: an id of the form
 * {@code <analysisName>-<n>}, absolute paths (resolved against the base directory)
 * and resources looked up from configuration. Not thread-safe.
 */
public class TaskQueue {

    private final RunController controller;
    private final ResourceCatalog catalog;
    private final Path baseDir;
    private final List<Task> tasks = new ArrayList<>();
    private final Map<String, Integer> counters = new HashMap<>();
    private final Set<String> ids = new HashSet<>();

    TaskQueue(RunController controller, ResourceCatalog catalog) {
        this(controller, catalog, Path.of("").toAbsolutePath());
    }

    TaskQueue(RunController controller, ResourceCatalog catalog, Path baseDir) {
        this.controller = controller;
        this.catalog = catalog;
        this.baseDir = baseDir;
    }

    /**
     * Adds a task whose id and resources are derived from its analysis name.
     *
     * @return the queued task
     */
    public Task add(String analysisName, String command, List<String> inputs, List<String> outputs) {
        return add(new Task(nextId(analysisName), analysisName, command, inputs, outputs, null));
    }

    /**
     * Adds a task, absolutizing its paths and resolving its resources when it has none.
     *
     * @return the queued task
     */
    public Task add(Task task) {
        Resources resources = task.resources() != null
                ? task.resources()
                : catalog.resourcesFor(task.analysisName());
        var queued = new Task(task.id(), task.analysisName(), task.command(),
                absolutize(task.inputs()), absolutize(task.outputs()), resources);
        tasks.add(queued);
        ids.add(queued.id());
        return queued;
    }

    public List<Task> tasks() {
        return List.copyOf(tasks);
    }

    public int size() {
        return tasks.size();
    }

    /**
     * Runs everything queued so far.
     */
    public RunOutcome run() {
        return controller.run(tasks());
    }

    /** Next free {@code <analysisName>-<n>}, skipping ids already taken by explicit tasks. */
    private String nextId(String analysisName) {
        String id;
        do {
            int n = counters.merge(analysisName, 1, Integer::sum);
            id = analysisName + "-" + n;
        } while (ids.contains(id));
        return id;
    }

    private List<String> absolutize(List<String> paths) {
        return paths.stream()
                .map(p -> baseDir.resolve(p).normalize().toString())
                .toList();
    }
}
