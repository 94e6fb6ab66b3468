package com.conclave.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * Immutable record of one execution attempt of a task.
 *
 * @param taskId       the task
 * @param attempt      1-based attempt number; 0 for a task cancelled before it ever started
 * @param status       outcome of the attempt
 * @param startTime    when the attempt entered RUNNING
 * @param endTime      when the outcome was recorded
 * @param exitCode     executor exit code, null when the process never reported one
 * @param stdoutRef    path of the captured stdout file, null when nothing was captured
 * @param stderrRef    path of the captured stderr file, null when nothing was captured
 * @param errorMessage failure description, null on success
 * @param retryCount   retries already performed when this attempt finished
 */
public record ExecutionResult(
    String taskId,
    int attempt,
    ExecutionOutcome status,
    Instant startTime,
    Instant endTime,
    Integer exitCode,
    String stdoutRef,
    String stderrRef,
    String errorMessage,
    int retryCount
) implements Serializable {

    public static ExecutionResult cancelled(String taskId, int attempt, Instant at, String reason) {
        return new ExecutionResult(taskId, attempt, ExecutionOutcome.CANCELLED, at, at,
                null, null, null, reason, Math.max(0, attempt - 1));
    }

    @JsonIgnore
    public Duration duration() {
        if (startTime == null || endTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ExecutionOutcome.SUCCESS;
    }
}
