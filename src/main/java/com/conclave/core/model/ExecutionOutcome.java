package com.conclave.core.model;

/**
 * Outcome of a single execution attempt.
 */
public enum ExecutionOutcome {
    SUCCESS,
    FAILED,
    TIMEOUT,
    CANCELLED
}
