package com.conclave.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Structured summary produced at the end of every run, successful or not.
 *
 * @param runId              the run
 * @param phase              final phase
 * @param tasks              per-task terminal status, in task id order
 * @param fatalError         message of the error that aborted the run, or null
 * @param resumable          false when a checkpoint write failed during the run
 * @param checkpointWarnings checkpoint problems observed during the run
 * @param startedAt          when the run (or resume) started
 * @param finishedAt         when the report was produced
 */
public record RunReport(
    String runId,
    WorkflowPhase phase,
    List<TaskReport> tasks,
    String fatalError,
    boolean resumable,
    List<String> checkpointWarnings,
    Instant startedAt,
    Instant finishedAt
) implements Serializable {

    public RunReport {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        checkpointWarnings = checkpointWarnings != null ? List.copyOf(checkpointWarnings) : List.of();
    }

    /** True when every task succeeded and nothing aborted the run. */
    @JsonIgnore
    public boolean succeeded() {
        return fatalError == null
                && tasks.stream().allMatch(t -> t.status() == TaskStatus.SUCCEEDED);
    }

    public long count(TaskStatus status) {
        return tasks.stream().filter(t -> t.status() == status).count();
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }
}
