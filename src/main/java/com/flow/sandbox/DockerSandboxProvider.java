package com.flow.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Docker-based SandboxProvider.
 * Creates one container per task execution.
 *
 * <p>Each container is configured with:
 * <ul>
 *   <li>A read-write bind mount for every directory of the task's inputs and outputs,
 *       mounted at the same path</li>
 *   <li>Memory and CPU limits from the task's resources</li>
 *   <li>Command: /bin/sh -c &lt;task command&gt;</li>
 * </ul>
 */
public class DockerSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxProvider.class);

    private static final String DOCKER_SCHEME = "docker://";

    private final DockerClient dockerClient;

    public DockerSandboxProvider(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    @Override
    public String openSandbox(SandboxRequest request) {
        String containerName = containerName(request.runId(), request.taskId());
        String imageName = imageName(request.containerRef());

        log.info("Opening sandbox {} for task {} (image: {})",
                containerName, request.taskId(), imageName);
        if (!request.extraRuntimeArgs().isBlank()) {
            log.debug("Ignoring extra runtime args for docker: {}", request.extraRuntimeArgs());
        }

        // Clean up any stale container with the same name from an earlier run
        try {
            dockerClient.removeContainerCmd(containerName).withForce(true).exec();
            log.debug("Removed stale container {}", containerName);
        } catch (RuntimeException e) {
            log.trace("No stale container {}: {}", containerName, e.getMessage());
        }

        var binds = request.bindPaths().stream()
                .map(dir -> new Bind(dir, new Volume(dir), AccessMode.rw))
                .toArray(Bind[]::new);

        var hostConfig = HostConfig.newHostConfig()
                .withBinds(binds)
                .withMemory((long) request.memoryMb() * 1024 * 1024)
                .withNanoCPUs((long) request.cpus() * 1_000_000_000L);

        var response = dockerClient.createContainerCmd(imageName)
                .withName(containerName)
                .withHostConfig(hostConfig)
                .withCmd("/bin/sh", "-c", request.command())
                .exec();

        String containerId = response.getId();
        try {
            dockerClient.startContainerCmd(containerId).exec();
        } catch (RuntimeException e) {
            log.warn("Container {} created but failed to start, removing it", containerId);
            try {
                dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            } catch (RuntimeException removeError) {
                e.addSuppressed(removeError);
            }
            throw e;
        }
        log.info("Sandbox {} started (container {})", containerName, containerId);
        return containerId;
    }

    @Override
    public int waitForCompletion(String sandboxId, int timeoutSeconds) {
        WaitContainerResultCallback callback;
        boolean completed;
        try {
            callback = dockerClient.waitContainerCmd(sandboxId)
                    .exec(new WaitContainerResultCallback());
            completed = callback.awaitCompletion(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for sandbox {}", sandboxId);
            return -1;
        } catch (RuntimeException e) {
            log.error("Error waiting for sandbox {}", sandboxId, e);
            return -1;
        }
        if (!completed) {
            throw new SandboxTimeoutException(sandboxId, timeoutSeconds);
        }
        try {
            Integer status = callback.awaitStatusCode();
            return status != null ? status : -1;
        } catch (RuntimeException e) {
            // container removed while waiting (cancelled)
            log.debug("No status code for sandbox {}: {}", sandboxId, e.getMessage());
            return -1;
        }
    }

    @Override
    public CapturedOutput captureOutput(String sandboxId) {
        var stdout = new StringBuilder();
        var stderr = new StringBuilder();
        try {
            dockerClient.logContainerCmd(sandboxId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(false)
                    .exec(new LogContainerResultCallback() {
                        @Override
                        public void onNext(Frame frame) {
                            String text = new String(frame.getPayload(), StandardCharsets.UTF_8);
                            if (frame.getStreamType() == StreamType.STDERR) {
                                stderr.append(text);
                            } else {
                                stdout.append(text);
                            }
                        }
                    }).awaitCompletion(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while capturing output from sandbox {}", sandboxId);
        } catch (RuntimeException e) {
            log.warn("Could not capture output from sandbox {}: {}", sandboxId, e.getMessage());
        }
        return new CapturedOutput(stdout.toString(), stderr.toString());
    }

    @Override
    public void teardownSandbox(String sandboxId) {
        try {
            dockerClient.stopContainerCmd(sandboxId).exec();
        } catch (RuntimeException e) {
            log.debug("Container {} may already be stopped: {}", sandboxId, e.getMessage());
        }
        try {
            dockerClient.removeContainerCmd(sandboxId).withForce(true).exec();
            log.info("Sandbox {} torn down", sandboxId);
        } catch (RuntimeException e) {
            log.debug("Container {} may already be removed: {}", sandboxId, e.getMessage());
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (RuntimeException e) {
            log.warn("Docker daemon not reachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String name() {
        return "docker";
    }

    /** Strips a {@code docker://} scheme; Docker takes plain image names. */
    static String imageName(String containerRef) {
        return containerRef.startsWith(DOCKER_SCHEME)
                ? containerRef.substring(DOCKER_SCHEME.length())
                : containerRef;
    }

    /** Docker names allow [a-zA-Z0-9_.-] only. */
    static String containerName(String runId, String taskId) {
        return ("flow-" + runId + "-" + taskId).replaceAll("[^a-zA-Z0-9_.-]", "_");
    }
}
