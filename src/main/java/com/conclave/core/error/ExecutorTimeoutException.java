package com.conclave.core.error;

import java.time.Duration;

/**
 * An executor attempt ran past its time limit.
 */
public class ExecutorTimeoutException extends ConclaveException {

    public ExecutorTimeoutException(String taskId, Duration timeout) {
        super("Task " + taskId + " timed out after " + timeout.toSeconds() + "s");
    }
}
