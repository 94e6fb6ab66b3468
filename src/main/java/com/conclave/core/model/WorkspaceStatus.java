package com.conclave.core.model;

public enum WorkspaceStatus {
    CREATED,
    ACTIVE,
    REMOVED
}
