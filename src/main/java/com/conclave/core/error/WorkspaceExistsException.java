package com.conclave.core.error;

/**
 * A live workspace already exists for the task.
 */
public class WorkspaceExistsException extends ConclaveException {

    public WorkspaceExistsException(String taskId) {
        super("Workspace already exists for task " + taskId);
    }
}
