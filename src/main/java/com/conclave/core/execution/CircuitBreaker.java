package com.conclave.core.execution;

import com.conclave.core.error.CircuitOpenException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker.State;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Failure-rate breaker over a sliding time window of attempt outcomes, backed by a resilience4j
 * state machine.
 *
 * <p>Once at least {@code minimumAttempts} outcomes sit in the window and the failure fraction
 * exceeds the threshold, the breaker opens. While open the engine runs one task at a time.
 * After the cool-down it closes and forgets the window.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private static final Duration MIN_WAIT = Duration.ofMillis(1);

    private final io.github.resilience4j.circuitbreaker.CircuitBreaker delegate;
    private final Duration window;
    private final Duration coolDown;
    private final Clock clock;

    private Instant openUntil;

    public CircuitBreaker(double failureRateThreshold, Duration window, int minimumAttempts,
                          Duration coolDown, Clock clock) {
        this.window = window;
        this.coolDown = coolDown;
        this.clock = clock;

        var config = CircuitBreakerConfig.custom()
                .failureRateThreshold(strictlyAbove(failureRateThreshold))
                .slidingWindowType(SlidingWindowType.TIME_BASED)
                .slidingWindowSize((int) Math.max(1, window.toSeconds()))
                .minimumNumberOfCalls(Math.max(1, minimumAttempts))
                .waitDurationInOpenState(coolDown.compareTo(MIN_WAIT) < 0 ? MIN_WAIT : coolDown)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
        this.delegate = new CircuitBreakerStateMachine("executor", config, clock);
    }

    /**
     * resilience4j opens at or above its threshold; nudge it so a rate equal to ours stays closed.
     * A threshold of 1.0 therefore opens only when every attempt in the window failed.
     */
    private static float strictlyAbove(double fraction) {
        float percent = (float) (fraction * 100.0);
        return Math.min(100f, Math.max(Math.nextUp(0f), Math.nextUp(percent)));
    }

    /**
     * Records one attempt outcome.
     *
     * @return true when this outcome tripped the breaker open
     */
    public synchronized boolean record(boolean failure) {
        var before = delegate.getState();
        if (failure) {
            delegate.onError(0, TimeUnit.NANOSECONDS, new AttemptFailed());
        } else {
            delegate.onSuccess(0, TimeUnit.NANOSECONDS);
        }
        if (before != State.OPEN && delegate.getState() == State.OPEN) {
            openUntil = clock.instant().plus(coolDown);
            var metrics = delegate.getMetrics();
            log.warn("Circuit breaker opened: {}/{} attempts failed in the last {}s; sequential until {}",
                    metrics.getNumberOfFailedCalls(), metrics.getNumberOfBufferedCalls(),
                    window.toSeconds(), openUntil);
            return true;
        }
        return false;
    }

    /**
     * Closes the breaker when its cool-down has elapsed.
     *
     * @return true when this call closed it
     */
    public synchronized boolean closeIfCooledDown() {
        if (delegate.getState() == State.OPEN && openUntil != null && !clock.instant().isBefore(openUntil)) {
            log.info("Circuit breaker closed after cool-down");
            delegate.transitionToClosedState();
            openUntil = null;
            return true;
        }
        return false;
    }

    /**
     * @throws CircuitOpenException while the breaker is open
     */
    public synchronized void ensureClosed() {
        if (delegate.getState() == State.OPEN) {
            throw new CircuitOpenException(openUntil != null ? openUntil : clock.instant().plus(coolDown));
        }
    }

    public synchronized boolean isOpen() {
        return delegate.getState() == State.OPEN;
    }

    public synchronized void reset() {
        delegate.reset();
        openUntil = null;
    }

    /** Marker recorded for a failed attempt; never thrown. */
    private static final class AttemptFailed extends RuntimeException {
        private AttemptFailed() {
            super("attempt failed", null, false, false);
        }
    }
}
