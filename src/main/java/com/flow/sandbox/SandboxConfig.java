package com.flow.sandbox;

import com.flow.core.config.FlowProperties;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the container backend from {@code flow.job-runner}.
 */
@Configuration
public class SandboxConfig {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    @ConditionalOnProperty(name = "flow.job-runner", havingValue = "docker")
    public DockerClient dockerClient(FlowProperties properties) {
        String dockerHost = properties.getDockerHost();
        if (dockerHost == null || dockerHost.isBlank()) {
            dockerHost = System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        }
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "flow.job-runner", havingValue = "docker")
    public SandboxProvider dockerSandboxProvider(DockerClient dockerClient) {
        return new DockerSandboxProvider(dockerClient);
    }

    @Bean
    @ConditionalOnProperty(name = "flow.job-runner", havingValue = "singularity", matchIfMissing = true)
    public SandboxProvider singularitySandboxProvider(FlowProperties properties) {
        return new SingularitySandboxProvider(properties.getSingularityBin());
    }
}
