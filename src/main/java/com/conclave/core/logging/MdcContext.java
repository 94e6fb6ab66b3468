package com.conclave.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Conclave-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String TASK_ID = "taskId";
    public static final String ATTEMPT = "attempt";
    public static final String GROUP_NUMBER = "groupNumber";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setTask(String runId, String taskId, int attempt) {
        MDC.put(RUN_ID, runId);
        MDC.put(TASK_ID, taskId);
        MDC.put(ATTEMPT, String.valueOf(attempt));
    }

    public static void setGroup(String runId, int groupNumber) {
        MDC.put(RUN_ID, runId);
        MDC.put(GROUP_NUMBER, String.valueOf(groupNumber));
    }

    /** Removes the per-task keys, keeping run and group context on the calling thread. */
    public static void clearTask() {
        MDC.remove(TASK_ID);
        MDC.remove(ATTEMPT);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(TASK_ID);
        MDC.remove(ATTEMPT);
        MDC.remove(GROUP_NUMBER);
    }
}
