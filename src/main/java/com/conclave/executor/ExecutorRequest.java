package com.conclave.executor;

import com.conclave.core.model.Task;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Input for one executor attempt.
 *
 * @param runId         the run the attempt belongs to
 * @param taskId        the task
 * @param attempt       1-based attempt number
 * @param workspacePath working directory of the attempt
 * @param task          full task definition
 * @param timeout       time limit for the attempt
 */
public record ExecutorRequest(
    String runId,
    String taskId,
    int attempt,
    Path workspacePath,
    Task task,
    Duration timeout
) {}
