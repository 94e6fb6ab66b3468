package com.conclave.core.error;

/**
 * An executor attempt finished with a non-zero exit code or could not be launched.
 */
public class ExecutorFailureException extends ConclaveException {

    private final Integer exitCode;

    public ExecutorFailureException(String taskId, int exitCode) {
        super("Task " + taskId + " exited with code " + exitCode);
        this.exitCode = exitCode;
    }

    public ExecutorFailureException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = null;
    }

    /** Exit code, or null when the process never ran. */
    public Integer getExitCode() {
        return exitCode;
    }
}
