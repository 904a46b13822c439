package com.numaansystems.crmedge.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Circuit breaker guarding calls to a single upstream dependency.
 *
 * <h2>States</h2>
 * <ul>
 *   <li><b>CLOSED</b>: calls pass through; {@code failureThreshold} consecutive
 *       failures open the circuit.</li>
 *   <li><b>OPEN</b>: calls are rejected with {@link CircuitOpenException} without
 *       being invoked until {@code resetTimeout} has elapsed since the last failure.</li>
 *   <li><b>HALF_OPEN</b>: up to {@code halfOpenProbeCount} probe calls are admitted.
 *       Any probe failure reopens the circuit; once that many probes have succeeded
 *       the circuit closes and the failure counter resets.</li>
 * </ul>
 *
 * <p>One instance must be shared for the lifetime of the dependency it guards. A breaker
 * created per request never accumulates failures and therefore never opens.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final int halfOpenProbeCount;
    private final Predicate<Throwable> recordFailure;
    private final Clock clock;

    private final CircuitBreakerState state = new CircuitBreakerState();

    public CircuitBreaker(String name, int failureThreshold, Duration resetTimeout, int halfOpenProbeCount) {
        this(name, failureThreshold, resetTimeout, halfOpenProbeCount, error -> true, Clock.systemUTC());
    }

    /**
     * @param recordFailure decides which exceptions count as dependency failures; the
     *                      others are rethrown but treated as a successful round trip
     */
    public CircuitBreaker(String name, int failureThreshold, Duration resetTimeout, int halfOpenProbeCount,
                          Predicate<Throwable> recordFailure, Clock clock) {
        if (failureThreshold < 1 || halfOpenProbeCount < 1) {
            throw new IllegalArgumentException("failureThreshold and halfOpenProbeCount must be positive");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.halfOpenProbeCount = halfOpenProbeCount;
        this.recordFailure = recordFailure;
        this.clock = clock;
    }

    /**
     * Invokes {@code operation} if the circuit admits it.
     *
     * @throws CircuitOpenException when the call is rejected
     */
    public <T> T execute(Callable<T> operation) {
        boolean probe = acquirePermission();
        T result;
        try {
            result = operation.call();
        } catch (Exception e) {
            if (recordFailure.test(e)) {
                onFailure(probe);
            } else {
                onSuccess(probe);
            }
            throw EdgeException.wrap(e);
        }
        onSuccess(probe);
        return result;
    }

    /**
     * Forces the circuit closed and clears all counters.
     */
    public synchronized void reset() {
        state.transitionTo(CircuitState.CLOSED);
        state.setLastFailureAt(null);
        logger.info("Circuit '{}' reset", name);
    }

    /**
     * @return a copy of the current state; moves OPEN to HALF_OPEN first if the cool-down has elapsed
     */
    public synchronized CircuitBreakerState getState() {
        moveToHalfOpenIfCooledDown();
        return state.copy();
    }

    public String getName() {
        return name;
    }

    private synchronized boolean acquirePermission() {
        moveToHalfOpenIfCooledDown();

        switch (state.getState()) {
            case OPEN:
                throw new CircuitOpenException(name, "Circuit '" + name + "' is open");
            case HALF_OPEN:
                int admitted = state.getHalfOpenProbesInFlight() + state.getHalfOpenProbesSucceeded();
                if (admitted >= halfOpenProbeCount) {
                    throw new CircuitOpenException(name, "Circuit '" + name + "' is half-open and probing");
                }
                state.setHalfOpenProbesInFlight(state.getHalfOpenProbesInFlight() + 1);
                return true;
            default:
                return false;
        }
    }

    private synchronized void onSuccess(boolean probe) {
        if (probe) {
            if (state.getState() != CircuitState.HALF_OPEN) {
                return;
            }
            state.setHalfOpenProbesInFlight(state.getHalfOpenProbesInFlight() - 1);
            state.setHalfOpenProbesSucceeded(state.getHalfOpenProbesSucceeded() + 1);
            if (state.getHalfOpenProbesSucceeded() >= halfOpenProbeCount) {
                state.transitionTo(CircuitState.CLOSED);
                logger.info("Circuit '{}' closed after {} successful probes", name, halfOpenProbeCount);
            }
        } else if (state.getState() == CircuitState.CLOSED) {
            state.setFailureCount(0);
        }
    }

    private synchronized void onFailure(boolean probe) {
        Instant now = clock.instant();
        if (probe) {
            if (state.getState() == CircuitState.HALF_OPEN) {
                state.setLastFailureAt(now);
                state.transitionTo(CircuitState.OPEN);
                logger.warn("Circuit '{}' reopened: half-open probe failed", name);
            }
            return;
        }
        if (state.getState() != CircuitState.CLOSED) {
            return;
        }
        state.setLastFailureAt(now);
        state.setFailureCount(state.getFailureCount() + 1);
        if (state.getFailureCount() >= failureThreshold) {
            state.transitionTo(CircuitState.OPEN);
            logger.warn("Circuit '{}' opened after {} consecutive failures", name, state.getFailureCount());
        }
    }

    private void moveToHalfOpenIfCooledDown() {
        if (state.getState() != CircuitState.OPEN) {
            return;
        }
        Instant reopenAt = state.getLastFailureAt().plus(resetTimeout);
        if (!clock.instant().isBefore(reopenAt)) {
            state.transitionTo(CircuitState.HALF_OPEN);
            logger.info("Circuit '{}' half-open, admitting up to {} probes", name, halfOpenProbeCount);
        }
    }
}
