package com.flow.core.config;

import com.flow.core.model.FailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolved {@code flow.*} configuration.
 *
 * <p>Sources, highest precedence first: command line ({@code --flow.x=y}), environment
 * ({@code FLOW_X}), {@code ~/.config/flow/flow.yml}, the packaged {@code application.yml}.
 */
@Component
@ConfigurationProperties(prefix = "flow")
public class FlowProperties {

    private String flowdir = ".flow";
    private String jobRunner = "singularity";
    private String singularityBin = "singularity";
    private String dockerHost = "";
    private FailurePolicy failurePolicy = FailurePolicy.FAIL_FAST;
    private int runTimeoutMinutes = 0;
    private Budget budget = new Budget();
    private Map<String, ResourceSpec> resources = new LinkedHashMap<>();

    public Path flowdirPath() {
        return Path.of(flowdir).toAbsolutePath();
    }

    /** {@code null} when no run timeout is configured. */
    public Duration runTimeout() {
        return runTimeoutMinutes > 0 ? Duration.ofMinutes(runTimeoutMinutes) : null;
    }

    public String getFlowdir() { return flowdir; }
    public void setFlowdir(String flowdir) { this.flowdir = flowdir; }
    public String getJobRunner() { return jobRunner; }
    public void setJobRunner(String jobRunner) { this.jobRunner = jobRunner; }
    public String getSingularityBin() { return singularityBin; }
    public void setSingularityBin(String singularityBin) { this.singularityBin = singularityBin; }
    public String getDockerHost() { return dockerHost; }
    public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
    public FailurePolicy getFailurePolicy() { return failurePolicy; }
    public void setFailurePolicy(FailurePolicy failurePolicy) { this.failurePolicy = failurePolicy; }
    public int getRunTimeoutMinutes() { return runTimeoutMinutes; }
    public void setRunTimeoutMinutes(int runTimeoutMinutes) { this.runTimeoutMinutes = runTimeoutMinutes; }
    public Budget getBudget() { return budget; }
    public void setBudget(Budget budget) { this.budget = budget; }
    public Map<String, ResourceSpec> getResources() { return resources; }
    public void setResources(Map<String, ResourceSpec> resources) { this.resources = resources; }

    /** Global ceiling on concurrently held resources. Zero means unlimited. */
    public static class Budget {
        private int cpus = 0;
        private long memoryMb = 0;

        public int getCpus() { return cpus; }
        public void setCpus(int cpus) { this.cpus = cpus; }
        public long getMemoryMb() { return memoryMb; }
        public void setMemoryMb(long memoryMb) { this.memoryMb = memoryMb; }
    }

    /**
     * Per-analysis resource entry, {@code flow.resources.<analysis>.*}.
     * Memory is in MB, time in minutes.
     */
    public static class ResourceSpec {
        private int cpus;
        private int memory;
        private int time;
        private String container;
        private String extraArgs = "";

        public ResourceSpec() {}

        public ResourceSpec(int cpus, int memory, int time, String container) {
            this.cpus = cpus;
            this.memory = memory;
            this.time = time;
            this.container = container;
        }

        public int getCpus() { return cpus; }
        public void setCpus(int cpus) { this.cpus = cpus; }
        public int getMemory() { return memory; }
        public void setMemory(int memory) { this.memory = memory; }
        public int getTime() { return time; }
        public void setTime(int time) { this.time = time; }
        public String getContainer() { return container; }
        public void setContainer(String container) { this.container = container; }
        public String getExtraArgs() { return extraArgs; }
        public void setExtraArgs(String extraArgs) { this.extraArgs = extraArgs; }
    }
}
