package com.flow.core.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.flow.core.config.FlowProperties;
import com.flow.core.config.ResourceCatalog;
import com.flow.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a YAML or JSON workflow file into tasks ready for a run.
 *
 * <p>Relative paths are resolved against the directory of the workflow file. Each
 * task's resources come from the file's {@code resources:} block when it names the
 * analysis, otherwise from {@code flow.resources}. Tasks without an id get
 * {@code <analysis>-<n>}.
 */
@Service
public class WorkflowDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowDefinitionLoader.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON = new ObjectMapper();

    private final ResourceCatalog catalog;

    public WorkflowDefinitionLoader(ResourceCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * @throws WorkflowDefinitionException if the file is unreadable or malformed
     */
    public List<Task> load(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(absolute)) {
            throw new WorkflowDefinitionException("workflow file not found: " + absolute);
        }
        WorkflowDefinition definition;
        try {
            definition = mapperFor(absolute).readValue(absolute.toFile(), WorkflowDefinition.class);
        } catch (JsonProcessingException e) {
            throw new WorkflowDefinitionException(
                    "malformed workflow " + absolute + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new WorkflowDefinitionException("cannot read workflow " + absolute, e);
        }
        if (definition == null) {
            throw new WorkflowDefinitionException("workflow " + absolute + " is empty");
        }
        List<Task> tasks = toTasks(definition, absolute.getParent());
        log.info("Loaded {} tasks from {}", tasks.size(), absolute);
        return tasks;
    }

    /**
     * Converts a parsed definition, resolving relative paths against {@code baseDir}.
     */
    public List<Task> toTasks(WorkflowDefinition definition, Path baseDir) {
        var overrides = new LinkedHashMap<String, FlowProperties.ResourceSpec>();
        definition.resources().forEach((analysis, entry) -> {
            if (entry == null) {
                throw new WorkflowDefinitionException("resources for " + analysis + " are empty");
            }
            var spec = new FlowProperties.ResourceSpec(entry.cpus(), entry.memory(), entry.time(), entry.container());
            spec.setExtraArgs(entry.extraArgs() != null ? entry.extraArgs() : "");
            overrides.put(analysis, spec);
        });

        var taken = new HashSet<String>();
        for (var entry : definition.tasks()) {
            if (entry != null && entry.id() != null && !entry.id().isBlank()) {
                taken.add(entry.id());
            }
        }
        var counters = new HashMap<String, Integer>();
        var tasks = new ArrayList<Task>();
        int index = 0;
        for (var entry : definition.tasks()) {
            index++;
            if (entry == null || entry.analysis() == null || entry.analysis().isBlank()) {
                throw new WorkflowDefinitionException("task #" + index + " has no analysis");
            }
            if (entry.command() == null || entry.command().isBlank()) {
                throw new WorkflowDefinitionException("task #" + index + " (" + entry.analysis() + ") has no command");
            }
            String analysis = entry.analysis();
            String id = entry.id() != null && !entry.id().isBlank()
                    ? entry.id()
                    : generateId(analysis, counters, taken);
            tasks.add(new Task(id, analysis, entry.command(),
                    absolutize(entry.inputs(), baseDir),
                    absolutize(entry.outputs(), baseDir),
                    catalog.resourcesFor(analysis, overrides)));
        }
        return tasks;
    }

    /** Next {@code <analysis>-<n>} that no explicit task id uses. */
    private static String generateId(String analysis, Map<String, Integer> counters, Set<String> taken) {
        String id;
        do {
            id = analysis + "-" + counters.merge(analysis, 1, Integer::sum);
        } while (!taken.add(id));
        return id;
    }

    private static List<String> absolutize(List<String> paths, Path baseDir) {
        if (paths == null) return List.of();
        return paths.stream()
                .map(p -> baseDir.resolve(p).normalize().toString())
                .toList();
    }

    private static ObjectMapper mapperFor(Path file) {
        return file.getFileName().toString().toLowerCase().endsWith(".json") ? JSON : YAML;
    }
}
