package com.conclave.core.error;

import java.time.Instant;

/**
 * The failure-rate circuit breaker is open; only one task may run at a time until it closes.
 */
public class CircuitOpenException extends ConclaveException {

    private final Instant closesAt;

    public CircuitOpenException(Instant closesAt) {
        super("Circuit breaker open until " + closesAt);
        this.closesAt = closesAt;
    }

    public Instant getClosesAt() {
        return closesAt;
    }
}
