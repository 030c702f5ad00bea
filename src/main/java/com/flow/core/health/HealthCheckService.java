package com.flow.core.health;

import com.flow.core.config.FlowProperties;
import com.flow.sandbox.SandboxProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SandboxProvider sandboxProvider;
    private final FlowProperties properties;

    public HealthCheckService(@Autowired(required = false) SandboxProvider sandboxProvider,
                              FlowProperties properties) {
        this.sandboxProvider = sandboxProvider;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkRunner());
        results.add(checkFlowdir());
        results.add(checkResources());
        return results;
    }

    private HealthStatus checkRunner() {
        if (sandboxProvider == null) {
            return new HealthStatus("runner", HealthStatus.Status.DOWN,
                    "No SandboxProvider configured for job-runner " + properties.getJobRunner(), Map.of());
        }
        try {
            if (sandboxProvider.isAvailable()) {
                return new HealthStatus("runner", HealthStatus.Status.UP,
                        sandboxProvider.name() + " available", Map.of("runner", sandboxProvider.name()));
            }
            return new HealthStatus("runner", HealthStatus.Status.DOWN,
                    sandboxProvider.name() + " not reachable", Map.of("runner", sandboxProvider.name()));
        } catch (RuntimeException e) {
            log.warn("Runner health check failed: {}", e.getMessage());
            return new HealthStatus("runner", HealthStatus.Status.DOWN,
                    "Runner error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkFlowdir() {
        var dir = properties.flowdirPath();
        try {
            Files.createDirectories(dir);
            if (Files.isWritable(dir)) {
                return new HealthStatus("flowdir", HealthStatus.Status.UP,
                        dir + " writable", Map.of("path", dir.toString()));
            }
            return new HealthStatus("flowdir", HealthStatus.Status.DOWN,
                    dir + " not writable", Map.of("path", dir.toString()));
        } catch (IOException e) {
            log.warn("Flowdir health check failed: {}", e.getMessage());
            return new HealthStatus("flowdir", HealthStatus.Status.DOWN,
                    "Cannot create " + dir + ": " + e.getMessage(), Map.of("path", dir.toString()));
        }
    }

    private HealthStatus checkResources() {
        int count = properties.getResources().size();
        if (count == 0) {
            return new HealthStatus("resources", HealthStatus.Status.DEGRADED,
                    "No analyses configured under flow.resources", Map.of());
        }
        return new HealthStatus("resources", HealthStatus.Status.UP,
                count + " analyses configured", Map.of("count", String.valueOf(count)));
    }
}
