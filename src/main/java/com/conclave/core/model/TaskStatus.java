package com.conclave.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Execution status of a task.
 *
 * <p>{@code QUEUED -> RUNNING -> {SUCCEEDED | FAILED | TIMED_OUT | CANCELLED}}.
 * A failed or timed-out attempt with attempts remaining goes back to QUEUED.
 * A task that exhausts its attempts ends FAILED, even if the last attempt timed out.
 */
public enum TaskStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        return allowedNext().contains(next);
    }

    private Set<TaskStatus> allowedNext() {
        return switch (this) {
            case QUEUED -> EnumSet.of(RUNNING, CANCELLED);
            case RUNNING -> EnumSet.of(SUCCEEDED, FAILED, TIMED_OUT, CANCELLED);
            case TIMED_OUT -> EnumSet.of(QUEUED, FAILED, CANCELLED);
            case FAILED -> EnumSet.of(QUEUED);
            case SUCCEEDED, CANCELLED -> EnumSet.noneOf(TaskStatus.class);
        };
    }
}
