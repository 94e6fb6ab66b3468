package com.conclave.core.error;

/**
 * Base of all orchestration failures. Unchecked: callers decide where a failure becomes fatal.
 */
public class ConclaveException extends RuntimeException {

    public ConclaveException(String message) {
        super(message);
    }

    public ConclaveException(String message, Throwable cause) {
        super(message, cause);
    }
}
