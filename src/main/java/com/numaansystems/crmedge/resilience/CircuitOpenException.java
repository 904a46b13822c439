package com.numaansystems.crmedge.resilience;

/**
 * Raised by {@link CircuitBreaker} when a call is rejected without being attempted.
 */
public class CircuitOpenException extends EdgeException {

    private final String circuitName;

    public CircuitOpenException(String circuitName, String message) {
        super(ErrorKind.UPSTREAM, message, 0, Boolean.FALSE, null);
        this.circuitName = circuitName;
    }

    public String getCircuitName() {
        return circuitName;
    }
}
