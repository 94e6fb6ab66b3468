package com.conclave.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConclaveMetricsTest {

    private SimpleMeterRegistry registry;
    private ConclaveMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ConclaveMetrics(registry);
    }

    @Test
    @DisplayName("recordAnalysisDuration creates a timer")
    void recordAnalysisDuration() {
        metrics.recordAnalysisDuration(1500);
        var timer = registry.find("conclave.analysis.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordTaskAttempt records by outcome tag")
    void recordTaskAttempt() {
        metrics.recordTaskAttempt("success", Duration.ofMillis(200));
        metrics.recordTaskAttempt("timeout", Duration.ofMillis(100));
        metrics.recordTaskAttempt("timeout", Duration.ofMillis(100));

        var success = registry.find("conclave.task.attempt.duration").tag("outcome", "success").timer();
        var timeout = registry.find("conclave.task.attempt.duration").tag("outcome", "timeout").timer();

        assertNotNull(success);
        assertNotNull(timeout);
        assertEquals(1, success.count());
        assertEquals(2, timeout.count());
    }

    @Test
    @DisplayName("recordWorktreeOperation tags operation and success")
    void recordWorktreeOperation() {
        metrics.recordWorktreeOperation("create", true);
        metrics.recordWorktreeOperation("create", true);
        metrics.recordWorktreeOperation("remove", false);

        var created = registry.find("conclave.parallel.worktree_operations")
                .tag("operation", "create").tag("success", "true").counter();
        var failedRemove = registry.find("conclave.parallel.worktree_operations")
                .tag("operation", "remove").tag("success", "false").counter();

        assertNotNull(created);
        assertNotNull(failedRemove);
        assertEquals(2.0, created.count());
        assertEquals(1.0, failedRemove.count());
    }

    @Test
    @DisplayName("retry, deferral and circuit counters increment")
    void counters() {
        metrics.recordRetry();
        metrics.recordRetry();
        metrics.recordConflictDeferral("TASK-001");
        metrics.recordCircuitOpened();

        assertEquals(2.0, registry.find("conclave.task.retries").counter().count());
        assertEquals(1.0, registry.find("conclave.parallel.conflict_deferrals").counter().count());
        assertEquals(1.0, registry.find("conclave.circuit.opened").counter().count());
    }

    @Test
    @DisplayName("recordCheckpointWrite separates success and failure")
    void recordCheckpointWrite() {
        metrics.recordCheckpointWrite(true);
        metrics.recordCheckpointWrite(false);

        assertEquals(1.0, registry.find("conclave.checkpoint.writes").tag("result", "success").counter().count());
        assertEquals(1.0, registry.find("conclave.checkpoint.writes").tag("result", "failure").counter().count());
    }

    @Test
    @DisplayName("recordGroupSize feeds a distribution summary")
    void recordGroupSize() {
        metrics.recordGroupSize(3);
        metrics.recordGroupSize(5);

        var summary = registry.find("conclave.group.task_count").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(8.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordRunResult counts by status")
    void recordRunResult() {
        metrics.recordRunResult("succeeded");
        metrics.recordRunResult("failed");
        metrics.recordRunResult("succeeded");

        assertEquals(2.0, registry.find("conclave.runs.total").tag("status", "succeeded").counter().count());
        assertEquals(1.0, registry.find("conclave.runs.total").tag("status", "failed").counter().count());
    }
}
