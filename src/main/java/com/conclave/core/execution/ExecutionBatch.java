package com.conclave.core.execution;

import com.conclave.core.model.ConflictMatrix;
import com.conclave.core.model.Task;

import java.time.Duration;
import java.util.List;

/**
 * One call's worth of work for the execution engine.
 *
 * @param runId          run the tasks belong to
 * @param tasks          tasks to drive to a terminal status
 * @param conflicts      pairwise conflicts; conflicting tasks never run at the same time
 * @param maxParallel    concurrency limit
 * @param perTaskTimeout time limit for each attempt
 * @param baseRef        reference new workspaces start from
 * @param listener       callbacks for the caller
 */
public record ExecutionBatch(
    String runId,
    List<Task> tasks,
    ConflictMatrix conflicts,
    int maxParallel,
    Duration perTaskTimeout,
    String baseRef,
    ExecutionListener listener
) {

    public ExecutionBatch {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1");
        }
        if (perTaskTimeout == null || perTaskTimeout.isNegative() || perTaskTimeout.isZero()) {
            throw new IllegalArgumentException("perTaskTimeout must be positive");
        }
        tasks = List.copyOf(tasks);
        conflicts = conflicts != null ? conflicts : ConflictMatrix.EMPTY;
        listener = listener != null ? listener : ExecutionListener.NOOP;
    }
}
