package com.conclave.core.error;

/**
 * The workspace backend failed to create, commit or remove a working copy.
 */
public class WorkspaceException extends ConclaveException {

    public WorkspaceException(String message) {
        super(message);
    }

    public WorkspaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
