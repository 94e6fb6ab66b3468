package com.conclave.core.execution;

import com.conclave.core.model.ExecutionResult;
import com.conclave.core.model.Task;
import com.conclave.core.model.TaskStatus;

import java.time.Duration;

/**
 * Callbacks from the execution loop. Invoked on the loop thread, so implementations may touch
 * the workspace manager and checkpoint store but should not block for long.
 */
public interface ExecutionListener {

    ExecutionListener NOOP = new ExecutionListener() {};

    default void onTaskStarted(Task task, int attempt) {}

    default void onTaskRetrying(Task task, ExecutionResult result, Duration backoff) {}

    /**
     * Called once per task when it settles in SUCCEEDED, FAILED or CANCELLED.
     *
     * @param result the last attempt, or null for a task cancelled before it ever ran
     */
    default void onTaskTerminal(Task task, TaskStatus status, ExecutionResult result) {}
}
