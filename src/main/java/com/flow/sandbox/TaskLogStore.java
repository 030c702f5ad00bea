package com.flow.sandbox;

import com.flow.core.config.FlowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persists the full output of each task under {@code <flowdir>/<runId>/<taskId>.log}.
 */
@Component
public class TaskLogStore {

    private static final Logger log = LoggerFactory.getLogger(TaskLogStore.class);

    private final FlowProperties properties;

    public TaskLogStore(FlowProperties properties) {
        this.properties = properties;
    }

    public Path logFile(String runId, String taskId) {
        return properties.flowdirPath().resolve(runId).resolve(taskId + ".log");
    }

    /**
     * Writes the task's output. A failure to write is logged and does not affect the task.
     *
     * @return the log file, or {@code null} if it could not be written
     */
    public Path write(String runId, String taskId, String command, int exitCode, CapturedOutput output) {
        Path file = logFile(runId, taskId);
        var sb = new StringBuilder();
        sb.append("# command: ").append(command).append('\n');
        sb.append("# exit code: ").append(exitCode).append('\n');
        sb.append("## stdout\n").append(output.stdout());
        if (!output.stdout().endsWith("\n")) sb.append('\n');
        sb.append("## stderr\n").append(output.stderr());
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, sb.toString());
            return file;
        } catch (IOException e) {
            log.warn("Could not write log for task {}: {}", taskId, e.getMessage());
            return null;
        }
    }
}
