package com.numaansystems.crmedge.resilience;

import java.time.Duration;

/**
 * Raised when an operation guarded by {@link Timeouts} does not finish in time.
 */
public class EdgeTimeoutException extends EdgeException {

    private final Duration timeout;

    public EdgeTimeoutException(String message, Duration timeout) {
        super(ErrorKind.TIMEOUT, message);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
