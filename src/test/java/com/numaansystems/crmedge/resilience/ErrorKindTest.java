package com.numaansystems.crmedge.resilience;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ErrorKind classification.
 */
class ErrorKindTest {

    @Test
    @DisplayName("Should map upstream HTTP statuses to kinds")
    void testFromStatus() {
        assertEquals(ErrorKind.VALIDATION, ErrorKind.fromStatus(400));
        assertEquals(ErrorKind.UNAUTHORIZED, ErrorKind.fromStatus(401));
        assertEquals(ErrorKind.FORBIDDEN, ErrorKind.fromStatus(403));
        assertEquals(ErrorKind.NOT_FOUND, ErrorKind.fromStatus(404));
        assertEquals(ErrorKind.CONFLICT, ErrorKind.fromStatus(409));
        assertEquals(ErrorKind.VALIDATION, ErrorKind.fromStatus(422));
        assertEquals(ErrorKind.RATE_LIMITED, ErrorKind.fromStatus(429));
        assertEquals(ErrorKind.UPSTREAM, ErrorKind.fromStatus(503));
        assertEquals(ErrorKind.TIMEOUT, ErrorKind.fromStatus(504));
    }

    @Test
    @DisplayName("Should classify transport exceptions")
    void testOfThrowable() {
        assertEquals(ErrorKind.TIMEOUT, ErrorKind.of(new SocketTimeoutException("read timed out")));
        assertEquals(ErrorKind.OFFLINE, ErrorKind.of(new UnknownHostException("api.example.com")));
        assertEquals(ErrorKind.NETWORK, ErrorKind.of(new ConnectException("refused")));
        assertEquals(ErrorKind.NETWORK, ErrorKind.of(new IOException("broken pipe")));
        assertEquals(ErrorKind.INVALID_INPUT, ErrorKind.of(new IllegalArgumentException("bad")));
        assertEquals(ErrorKind.UNKNOWN, ErrorKind.of(new UnsupportedOperationException("nope")));
    }

    @Test
    @DisplayName("Should retry only network, timeout and rate-limit failures by default")
    void testDefaultRetryability() {
        for (ErrorKind kind : ErrorKind.values()) {
            boolean expected = kind == ErrorKind.NETWORK || kind == ErrorKind.TIMEOUT || kind == ErrorKind.RATE_LIMITED;
            assertEquals(expected, kind.isRetryableByDefault(), kind.name());
        }
    }
}
