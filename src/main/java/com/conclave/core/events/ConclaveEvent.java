package com.conclave.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a run executes, consumed by the CLI progress view.
 *
 * @param eventType event type (e.g. "run.started", "task.retrying", "circuit.opened")
 * @param runId     the run this event belongs to
 * @param taskId    the task this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ConclaveEvent(
    String eventType,
    String runId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RUN_STARTED = "run.started";
    public static final String GROUP_STARTED = "group.started";
    public static final String TASK_STARTED = "task.started";
    public static final String TASK_RETRYING = "task.retrying";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_CANCELLED = "task.cancelled";
    public static final String CIRCUIT_OPENED = "circuit.opened";
    public static final String CIRCUIT_CLOSED = "circuit.closed";
    public static final String RUN_COMPLETED = "run.completed";

    public static ConclaveEvent of(String eventType, String runId, String taskId, Map<String, Object> payload) {
        return new ConclaveEvent(eventType, runId, taskId, payload != null ? payload : Map.of(), Instant.now());
    }
}
