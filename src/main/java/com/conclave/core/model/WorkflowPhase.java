package com.conclave.core.model;

/**
 * Lifecycle phase of an orchestration run, recorded in every checkpoint.
 */
public enum WorkflowPhase {
    INITIALIZED,
    ANALYZED,
    EXECUTING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isResumable() {
        return this == INITIALIZED || this == ANALYZED || this == EXECUTING;
    }
}
