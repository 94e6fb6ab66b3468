package com.conclave.core.model;

/**
 * The independent axes along which two tasks can conflict.
 */
public enum ConflictDimension {
    FILE,
    SEMANTIC,
    RESOURCE,
    INTERFACE,
    STATE,
    TEST_ENVIRONMENT
}
