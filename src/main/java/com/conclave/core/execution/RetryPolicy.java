package com.conclave.core.execution;

import java.time.Duration;

/**
 * Bounded retry with capped exponential backoff: after attempt {@code n} the next attempt
 * waits {@code min(base * 2^n, max)}.
 *
 * @param maxAttempts total attempts allowed per task, at least 1
 * @param base        backoff base
 * @param max         backoff ceiling
 */
public record RetryPolicy(int maxAttempts, Duration base, Duration max) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public boolean canRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Delay before the attempt that follows attempt number {@code attemptsMade}.
     */
    public Duration backoff(int attemptsMade) {
        long baseMillis = base.toMillis();
        long maxMillis = max.toMillis();
        int shift = Math.min(Math.max(attemptsMade, 0), 30);
        long delay = baseMillis > (maxMillis >> shift) ? maxMillis : baseMillis << shift;
        return Duration.ofMillis(Math.min(delay, maxMillis));
    }
}
