package com.flow.sandbox;

import com.flow.core.model.Resources;
import com.flow.core.model.Task;
import com.flow.core.model.TaskResult;
import com.flow.core.scheduler.TaskExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executes tasks inside sandbox containers.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Derives bind mounts from the directories of a task's inputs and outputs</li>
 *   <li>Delegates container lifecycle to {@link SandboxProvider}</li>
 *   <li>Enforces the task's time limit and always tears the sandbox down</li>
 *   <li>Stores the full output through {@link TaskLogStore} and returns trimmed summaries</li>
 * </ul>
 */
@Service
public class SandboxManager implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(SandboxManager.class);

    /** Maximum characters kept in a {@link TaskResult} summary. */
    static final int SUMMARY_LIMIT = 2000;

    private final SandboxProvider provider;
    private final TaskLogStore logStore;

    /** Open sandboxes keyed by runId/taskId, used by {@link #cancel}. */
    private final Map<String, String> openSandboxes = new ConcurrentHashMap<>();

    /** runId/taskId of tasks cancelled while their sandbox was not open yet. */
    private final Set<String> cancelRequested = ConcurrentHashMap.newKeySet();

    public SandboxManager(SandboxProvider provider, TaskLogStore logStore) {
        this.provider = provider;
        this.logStore = logStore;
    }

    /**
     * Runs a task once.
     *
     * <p>Flow: prepare output directories -> open sandbox -> wait -> capture output ->
     * write log -> teardown -> return result.
     */
    @Override
    public TaskResult execute(String runId, Task task) {
        Resources r = task.resources();
        var request = new SandboxRequest(
            runId, task.id(), r.containerRef(), task.command(),
            r.cpus(), r.memoryMb(), bindPaths(task), r.extraRuntimeArgs()
        );
        int timeoutSeconds = timeoutSeconds(r);
        String key = key(runId, task.id());

        long startMs = System.currentTimeMillis();
        if (cancelRequested.remove(key)) {
            log.info("Task {} was cancelled before its sandbox opened", task.id());
            return TaskResult.error("cancelled", 0L);
        }
        String sandboxId;
        try {
            prepareOutputDirectories(task);
            sandboxId = provider.openSandbox(request);
        } catch (RuntimeException e) {
            cancelRequested.remove(key);
            log.error("Could not start sandbox for task {}: {}", task.id(), e.getMessage(), e);
            return TaskResult.error("could not start sandbox: " + e.getMessage(),
                    System.currentTimeMillis() - startMs);
        }

        openSandboxes.put(key, sandboxId);
        try {
            // a cancel that arrived while opening found nothing to tear down
            if (cancelRequested.remove(key)) {
                log.info("Task {} was cancelled while sandbox {} was opening", task.id(), sandboxId);
                return TaskResult.error("cancelled", System.currentTimeMillis() - startMs);
            }
            int exitCode;
            boolean timedOut = false;
            try {
                exitCode = provider.waitForCompletion(sandboxId, timeoutSeconds);
            } catch (SandboxTimeoutException e) {
                log.warn("Task {} exceeded its time limit of {} minutes", task.id(), r.timeLimitMinutes());
                exitCode = -1;
                timedOut = true;
            }
            CapturedOutput output = provider.captureOutput(sandboxId);
            long elapsedMs = System.currentTimeMillis() - startMs;
            logStore.write(runId, task.id(), task.command(), exitCode, output);

            log.info("Sandbox {} for task {} finished with exit code {} in {}ms",
                    sandboxId, task.id(), exitCode, elapsedMs);

            String stdout = summarize(output.stdout());
            String stderr = summarize(output.stderr());
            return timedOut
                    ? TaskResult.timedOut(stdout, stderr, elapsedMs)
                    : TaskResult.exited(exitCode, stdout, stderr, elapsedMs);
        } finally {
            openSandboxes.remove(key);
            cancelRequested.remove(key);
            provider.teardownSandbox(sandboxId);
        }
    }

    /**
     * Tears down the task's sandbox. When the sandbox is not open yet, the request is
     * remembered and {@link #execute} stops the task as soon as it gets that far.
     */
    @Override
    public void cancel(String runId, Task task) {
        String key = key(runId, task.id());
        // marked before the lookup: execute publishes the sandbox before checking the mark
        cancelRequested.add(key);
        String sandboxId = openSandboxes.get(key);
        if (sandboxId == null) {
            log.info("Cancelling task {} before its sandbox is open", task.id());
            return;
        }
        log.info("Cancelling task {} (sandbox {})", task.id(), sandboxId);
        provider.teardownSandbox(sandboxId);
    }

    /** Time limit in seconds, saturating instead of overflowing for very large limits. */
    static int timeoutSeconds(Resources resources) {
        long seconds = (long) resources.timeLimitMinutes() * 60;
        return (int) Math.min(seconds, Integer.MAX_VALUE);
    }

    /** Distinct parent directories of the task's inputs and outputs, in declaration order. */
    static List<String> bindPaths(Task task) {
        var dirs = new LinkedHashSet<String>();
        for (String p : task.inputs()) {
            addParent(dirs, p);
        }
        for (String p : task.outputs()) {
            addParent(dirs, p);
        }
        return List.copyOf(dirs);
    }

    private static void addParent(LinkedHashSet<String> dirs, String path) {
        Path parent = Path.of(path).getParent();
        if (parent != null) {
            dirs.add(parent.toString());
        }
    }

    /** Output directories must exist before they can be bind-mounted. */
    private static void prepareOutputDirectories(Task task) {
        for (String output : task.outputs()) {
            Path parent = Path.of(output).getParent();
            if (parent == null) continue;
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new IllegalStateException("cannot create output directory " + parent, e);
            }
        }
    }

    /** Keeps the tail of the text, where errors usually are. */
    static String summarize(String text) {
        if (text == null) return "";
        String trimmed = text.strip();
        if (trimmed.length() <= SUMMARY_LIMIT) return trimmed;
        return "..." + trimmed.substring(trimmed.length() - SUMMARY_LIMIT);
    }

    private static String key(String runId, String taskId) {
        return runId + "/" + taskId;
    }
}
