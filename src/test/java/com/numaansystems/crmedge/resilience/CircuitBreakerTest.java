package com.numaansystems.crmedge.resilience;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CircuitBreaker.
 *
 * <p>Covers opening after consecutive failures, rejection while open, the half-open
 * probe budget and manual reset.</p>
 */
class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        breaker = new CircuitBreaker("test", 3, Duration.ofSeconds(30), 2, error -> true, clock);
        invocations = new AtomicInteger();
    }

    private String failingCall() throws IOException {
        invocations.incrementAndGet();
        throw new IOException("connection reset");
    }

    private String succeedingCall() {
        invocations.incrementAndGet();
        return "ok";
    }

    private void failTimes(int times) {
        for (int i = 0; i < times; i++) {
            assertThrows(EdgeException.class, () -> breaker.execute(this::failingCall));
        }
    }

    @Test
    @DisplayName("Should stay closed below the failure threshold")
    void testStaysClosedBelowThreshold() {
        // Act
        failTimes(2);

        // Assert
        CircuitBreakerState state = breaker.getState();
        assertEquals(CircuitState.CLOSED, state.getState());
        assertEquals(2, state.getFailureCount());
    }

    @Test
    @DisplayName("Should open after N consecutive failures and reject without invoking")
    void testOpensAfterThreshold() {
        // Arrange
        failTimes(3);
        int callsBefore = invocations.get();

        // Act
        CircuitOpenException rejected = assertThrows(CircuitOpenException.class,
                () -> breaker.execute(this::succeedingCall));

        // Assert
        assertEquals(CircuitState.OPEN, breaker.getState().getState());
        assertEquals(callsBefore, invocations.get(), "Open circuit must not invoke the operation");
        assertEquals("test", rejected.getCircuitName());
        assertFalse(rejected.isRetryable());
    }

    @Test
    @DisplayName("Should reset the failure count after a success")
    void testSuccessResetsFailures() {
        // Arrange
        failTimes(2);

        // Act
        breaker.execute(this::succeedingCall);
        failTimes(2);

        // Assert
        assertEquals(CircuitState.CLOSED, breaker.getState().getState());
    }

    @Test
    @DisplayName("Should move to half-open after the reset timeout")
    void testHalfOpenAfterTimeout() {
        // Arrange
        failTimes(3);

        // Act
        clock.advance(Duration.ofSeconds(29));
        CircuitState beforeTimeout = breaker.getState().getState();
        clock.advance(Duration.ofSeconds(1));
        CircuitState afterTimeout = breaker.getState().getState();

        // Assert
        assertEquals(CircuitState.OPEN, beforeTimeout);
        assertEquals(CircuitState.HALF_OPEN, afterTimeout);
    }

    @Test
    @DisplayName("Should close after the configured number of successful probes")
    void testClosesAfterSuccessfulProbes() {
        // Arrange
        failTimes(3);
        clock.advance(Duration.ofSeconds(30));

        // Act
        breaker.execute(this::succeedingCall);
        CircuitState afterFirstProbe = breaker.getState().getState();
        breaker.execute(this::succeedingCall);

        // Assert
        assertEquals(CircuitState.HALF_OPEN, afterFirstProbe);
        CircuitBreakerState state = breaker.getState();
        assertEquals(CircuitState.CLOSED, state.getState());
        assertEquals(0, state.getFailureCount());
    }

    @Test
    @DisplayName("Should reopen when a half-open probe fails")
    void testProbeFailureReopens() {
        // Arrange
        failTimes(3);
        clock.advance(Duration.ofSeconds(30));

        // Act
        breaker.execute(this::succeedingCall);
        assertThrows(EdgeException.class, () -> breaker.execute(this::failingCall));

        // Assert
        assertEquals(CircuitState.OPEN, breaker.getState().getState());
        assertThrows(CircuitOpenException.class, () -> breaker.execute(this::succeedingCall));
    }

    @Test
    @DisplayName("Should admit no more than the probe budget while half-open")
    void testProbeBudget() throws Exception {
        // Arrange
        CircuitBreaker singleProbe = new CircuitBreaker("single", 1, Duration.ofSeconds(5), 1, error -> true, clock);
        assertThrows(EdgeException.class, () -> singleProbe.execute(this::failingCall));
        clock.advance(Duration.ofSeconds(5));

        // Act: a second call arrives while the first probe is still in flight
        AtomicInteger nested = new AtomicInteger();
        String result = singleProbe.execute(() -> {
            assertThrows(CircuitOpenException.class, () -> singleProbe.execute(this::succeedingCall));
            nested.incrementAndGet();
            return "probe";
        });

        // Assert
        assertEquals("probe", result);
        assertEquals(1, nested.get());
        assertEquals(CircuitState.CLOSED, singleProbe.getState().getState());
    }

    @Test
    @DisplayName("Should not count failures the predicate ignores")
    void testRecordFailurePredicate() {
        // Arrange
        CircuitBreaker selective = new CircuitBreaker("selective", 1, Duration.ofSeconds(5), 1,
                error -> !(error instanceof IllegalArgumentException), clock);

        // Act
        assertThrows(IllegalArgumentException.class, () -> selective.execute(() -> {
            throw new IllegalArgumentException("bad input");
        }));

        // Assert
        assertEquals(CircuitState.CLOSED, selective.getState().getState());
    }

    @Test
    @DisplayName("Should force the circuit closed on reset")
    void testReset() {
        // Arrange
        failTimes(3);

        // Act
        breaker.reset();

        // Assert
        assertEquals(CircuitState.CLOSED, breaker.getState().getState());
        assertEquals("ok", breaker.execute(this::succeedingCall));
    }
}
