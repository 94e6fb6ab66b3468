package com.conclave.core.error;

/**
 * A task input could not be read or is invalid.
 */
public class InputParseException extends ConclaveException {

    private final String source;

    public InputParseException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public InputParseException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
