package com.conclave.core.model;

/**
 * Coarse complexity bucket derived from a task's complexity score.
 */
public enum Complexity {
    LOW,
    MEDIUM,
    HIGH
}
