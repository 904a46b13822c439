package com.numaansystems.crmedge.resilience;

import java.time.Instant;

/**
 * Mutable state of a single {@link CircuitBreaker}.
 *
 * <p>Only the owning breaker mutates it, under its own lock. Callers receive
 * copies through {@link CircuitBreaker#getState()}.</p>
 */
public final class CircuitBreakerState {

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureAt;
    private int halfOpenProbesSucceeded;
    private int halfOpenProbesInFlight;

    CircuitBreakerState() {
    }

    CircuitBreakerState copy() {
        CircuitBreakerState copy = new CircuitBreakerState();
        copy.state = state;
        copy.failureCount = failureCount;
        copy.lastFailureAt = lastFailureAt;
        copy.halfOpenProbesSucceeded = halfOpenProbesSucceeded;
        copy.halfOpenProbesInFlight = halfOpenProbesInFlight;
        return copy;
    }

    void transitionTo(CircuitState next) {
        state = next;
        halfOpenProbesSucceeded = 0;
        halfOpenProbesInFlight = 0;
        if (next == CircuitState.CLOSED) {
            failureCount = 0;
        }
    }

    void setFailureCount(int failureCount) {
        this.failureCount = failureCount;
    }

    void setLastFailureAt(Instant lastFailureAt) {
        this.lastFailureAt = lastFailureAt;
    }

    void setHalfOpenProbesSucceeded(int halfOpenProbesSucceeded) {
        this.halfOpenProbesSucceeded = halfOpenProbesSucceeded;
    }

    void setHalfOpenProbesInFlight(int halfOpenProbesInFlight) {
        this.halfOpenProbesInFlight = halfOpenProbesInFlight;
    }

    public CircuitState getState() {
        return state;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public Instant getLastFailureAt() {
        return lastFailureAt;
    }

    public int getHalfOpenProbesSucceeded() {
        return halfOpenProbesSucceeded;
    }

    public int getHalfOpenProbesInFlight() {
        return halfOpenProbesInFlight;
    }
}
