package com.conclave.core.error;

/**
 * A checkpoint could not be written or read.
 */
public class CheckpointIOException extends ConclaveException {

    public CheckpointIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
