package com.conclave.core.config;

import com.conclave.executor.DockerTaskExecutor;
import com.conclave.executor.ExecutorConfig;
import com.conclave.executor.ExternalTaskExecutor;
import com.conclave.executor.LocalProcessExecutor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConclavePropertiesTest {

    @Test
    @DisplayName("defaults match the documented configuration")
    void defaults() {
        var properties = new ConclaveProperties();

        assertEquals(4, properties.getExecution().getMaxParallel());
        assertEquals(Duration.ofMinutes(30), properties.getExecution().taskTimeout());
        assertEquals(Duration.ofMillis(500), properties.getExecution().pollInterval());
        assertEquals(3, properties.getExecution().getMaxAttempts());
        assertEquals(0.5, properties.getCircuitBreaker().getFailureRateThreshold());
        assertEquals("HEAD", properties.getWorkspace().getBaseRef());
        assertEquals("conclave/", properties.getWorkspace().getBranchPrefix());
        assertTrue(properties.getWorkspace().isCommitResults());
        assertEquals(7.0, properties.getAnalysis().getDecompositionThreshold());
        assertEquals(0, properties.getAnalysis().getMaxGroupSize());
        assertTrue(properties.getAnalysis().getHighRiskKeywords().contains("migration"));
        assertEquals(".conclave/runs", properties.getCheckpoint().getDirectory());
        assertEquals("local", properties.getExecutor().getStrategy());
    }

    @Test
    @DisplayName("binds kebab-case keys under the conclave prefix")
    void binding() {
        var source = new MapConfigurationPropertySource(Map.of(
                "conclave.execution.max-parallel", "8",
                "conclave.execution.task-timeout-seconds", "60",
                "conclave.workspace.branch-prefix", "batch/",
                "conclave.analysis.high-risk-keywords[0]", "billing",
                "conclave.executor.command[0]", "agent",
                "conclave.executor.command[1]", "--task"));

        var properties = new Binder(source).bind("conclave", ConclaveProperties.class).get();

        assertEquals(8, properties.getExecution().getMaxParallel());
        assertEquals(Duration.ofSeconds(60), properties.getExecution().taskTimeout());
        assertEquals("batch/", properties.getWorkspace().getBranchPrefix());
        assertEquals(List.of("billing"), properties.getAnalysis().getHighRiskKeywords());
        assertEquals(List.of("agent", "--task"), properties.getExecutor().getCommand());
    }

    @Nested
    @DisplayName("executor strategy")
    class Strategy {

        @Configuration
        @EnableConfigurationProperties(ConclaveProperties.class)
        static class PropertiesOnly {}

        private final ApplicationContextRunner runner = new ApplicationContextRunner()
                .withUserConfiguration(PropertiesOnly.class, ExecutorConfig.class);

        @Test
        void localIsTheDefault() {
            runner.run(context -> {
                assertEquals(1, context.getBeansOfType(ExternalTaskExecutor.class).size());
                assertInstanceOf(LocalProcessExecutor.class, context.getBean(ExternalTaskExecutor.class));
            });
        }

        @Test
        void dockerWhenSelected() {
            runner.withPropertyValues("conclave.executor.strategy=docker", "conclave.executor.image=python:3.12")
                    .run(context -> assertInstanceOf(DockerTaskExecutor.class,
                            context.getBean(ExternalTaskExecutor.class)));
        }
    }
}
