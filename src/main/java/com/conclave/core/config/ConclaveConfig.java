package com.conclave.core.config;

import com.conclave.core.analysis.ConflictDetector;
import com.conclave.core.events.EventBus;
import com.conclave.core.execution.CircuitBreaker;
import com.conclave.core.execution.ExecutionEngine;
import com.conclave.core.execution.OutputStore;
import com.conclave.core.execution.RetryPolicy;
import com.conclave.core.metrics.ConclaveMetrics;
import com.conclave.core.persistence.CheckpointManager;
import com.conclave.core.registry.ProcessRegistry;
import com.conclave.executor.ExternalTaskExecutor;
import com.conclave.workspace.WorkspaceManager;
import com.conclave.workspace.git.GitWorktreeBackend;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Builds the orchestration components that need configured values at construction time.
 */
@Configuration
public class ConclaveConfig {

    private static final Logger log = LoggerFactory.getLogger(ConclaveConfig.class);

    @Bean
    @ConditionalOnMissingBean(ObjectMapper.class)
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * In-process registry, used when no monitoring backend contributes one.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry simpleMeterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WorkspaceManager workspaceManager(ConclaveProperties properties, ConclaveMetrics metrics, Clock clock) {
        var workspace = properties.getWorkspace();
        Path repository = Path.of(workspace.getRepository()).toAbsolutePath().normalize();
        log.info("Workspaces for {} under {}", repository, workspace.getRoot());
        return new WorkspaceManager(new GitWorktreeBackend(repository), repository, workspace.getRoot(),
                workspace.getBranchPrefix(), metrics, clock);
    }

    @Bean
    public OutputStore outputStore(ConclaveProperties properties) {
        return new OutputStore(Path.of(properties.getCheckpoint().getDirectory()));
    }

    @Bean
    public RetryPolicy retryPolicy(ConclaveProperties properties) {
        var execution = properties.getExecution();
        return new RetryPolicy(execution.getMaxAttempts(),
                Duration.ofMillis(execution.getBackoffBaseMillis()),
                Duration.ofMillis(execution.getBackoffMaxMillis()));
    }

    @Bean
    public CircuitBreaker circuitBreaker(ConclaveProperties properties, Clock clock) {
        var breaker = properties.getCircuitBreaker();
        return new CircuitBreaker(breaker.getFailureRateThreshold(),
                Duration.ofSeconds(breaker.getWindowSeconds()),
                breaker.getMinimumAttempts(),
                Duration.ofSeconds(breaker.getCoolDownSeconds()),
                clock);
    }

    @Bean(destroyMethod = "close")
    public ExecutionEngine executionEngine(ExternalTaskExecutor executor,
                                           WorkspaceManager workspaceManager,
                                           ProcessRegistry registry,
                                           OutputStore outputStore,
                                           RetryPolicy retryPolicy,
                                           CircuitBreaker circuitBreaker,
                                           ConflictDetector conflictDetector,
                                           EventBus eventBus,
                                           ConclaveMetrics metrics,
                                           Clock clock,
                                           ConclaveProperties properties) {
        return new ExecutionEngine(executor, workspaceManager, registry, outputStore, retryPolicy,
                circuitBreaker, conflictDetector, eventBus, metrics, clock,
                properties.getExecution().pollInterval(), properties.getWorkspace().getBaseRef());
    }

    @Bean
    public CheckpointManager checkpointManager(ObjectMapper objectMapper, ConclaveProperties properties,
                                               ConclaveMetrics metrics, Clock clock) {
        return new CheckpointManager(objectMapper, Path.of(properties.getCheckpoint().getDirectory()), metrics, clock);
    }
}
