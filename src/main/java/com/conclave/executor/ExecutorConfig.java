package com.conclave.executor;

import com.conclave.core.config.ConclaveProperties;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the executor strategy at context start from {@code conclave.executor.strategy}.
 */
@Configuration
public class ExecutorConfig {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    @ConditionalOnProperty(name = "conclave.executor.strategy", havingValue = "local", matchIfMissing = true)
    public ExternalTaskExecutor localProcessExecutor(ConclaveProperties properties) {
        return new LocalProcessExecutor(properties.getExecutor().getCommand());
    }

    @Bean
    @ConditionalOnProperty(name = "conclave.executor.strategy", havingValue = "docker")
    public DockerClient dockerClient() {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support (no junixsocket needed)
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "conclave.executor.strategy", havingValue = "docker")
    public ExternalTaskExecutor dockerTaskExecutor(DockerClient dockerClient, ConclaveProperties properties) {
        var executor = properties.getExecutor();
        return new DockerTaskExecutor(dockerClient, executor.getImage(), executor.getCommand(),
                executor.getMemoryLimitMb(), executor.getCpuCount());
    }
}
