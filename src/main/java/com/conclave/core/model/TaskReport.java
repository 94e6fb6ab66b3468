package com.conclave.core.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * Final per-task line of a run report.
 */
public record TaskReport(
    String taskId,
    String title,
    TaskStatus status,
    int attempts,
    Duration duration,
    String errorMessage
) implements Serializable {}
