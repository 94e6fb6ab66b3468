package com.conclave.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Conclave run execution.
 */
@Service
public class ConclaveMetrics {

    private final MeterRegistry registry;

    public ConclaveMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAnalysisDuration(long ms) {
        Timer.builder("conclave.analysis.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records one execution attempt.
     *
     * @param outcome "success", "failed", "timeout" or "cancelled"
     */
    public void recordTaskAttempt(String outcome, Duration duration) {
        Timer.builder("conclave.task.attempt.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(duration);
    }

    public void recordRetry() {
        Counter.builder("conclave.task.retries")
                .description("Attempts re-queued after a failure or timeout")
                .register(registry)
                .increment();
    }

    /**
     * Records when a task is held back because it conflicts with a task already running
     * or already placed in the same group.
     */
    public void recordConflictDeferral(String taskId) {
        Counter.builder("conclave.parallel.conflict_deferrals")
                .description("Tasks deferred due to conflicts")
                .register(registry)
                .increment();
    }

    public void recordCircuitOpened() {
        Counter.builder("conclave.circuit.opened")
                .description("Failure-rate circuit breaker trips")
                .register(registry)
                .increment();
    }

    /**
     * Records worktree operations for monitoring parallel execution health.
     *
     * @param operation "create", "remove", "reclaim" or "commit"
     * @param success   whether the operation succeeded
     */
    public void recordWorktreeOperation(String operation, boolean success) {
        Counter.builder("conclave.parallel.worktree_operations")
                .description("Git worktree lifecycle operations")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordCheckpointWrite(boolean success) {
        Counter.builder("conclave.checkpoint.writes")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordGroupSize(int taskCount) {
        DistributionSummary.builder("conclave.group.task_count")
                .description("Number of tasks per parallel group")
                .register(registry)
                .record(taskCount);
    }

    public void recordRunResult(String status) {
        Counter.builder("conclave.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
