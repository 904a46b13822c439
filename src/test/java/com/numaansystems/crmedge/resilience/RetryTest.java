package com.numaansystems.crmedge.resilience;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Retry.
 *
 * <p>A recording sleeper replaces {@code Thread.sleep} so backoff delays can be
 * asserted without waiting.</p>
 */
class RetryTest {

    private List<Duration> sleeps;
    private Retry retry;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        retry = new Retry(sleeps::add, new Random(42));
    }

    @Test
    @DisplayName("Should succeed after k failures when k < maxAttempts")
    void testSucceedsAfterTransientFailures() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(4, Duration.ofMillis(100), Duration.ofSeconds(5), 2.0);

        // Act
        String result = retry.execute(() -> {
            if (calls.incrementAndGet() <= 2) {
                throw new ConnectException("refused");
            }
            return "done";
        }, policy);

        // Assert
        assertEquals("done", result);
        assertEquals(3, calls.get());
        assertEquals(2, sleeps.size(), "One pause before each retry");
    }

    @Test
    @DisplayName("Should rethrow the last error when attempts are exhausted")
    void testGivesUpAfterMaxAttempts() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofSeconds(1), 2.0);

        // Act
        EdgeException error = assertThrows(EdgeException.class, () -> retry.execute(() -> {
            calls.incrementAndGet();
            throw new IOException("attempt " + calls.get());
        }, policy));

        // Assert
        assertEquals(3, calls.get());
        assertEquals(ErrorKind.NETWORK, error.getKind());
        assertEquals("attempt 3", error.getMessage());
    }

    @Test
    @DisplayName("Should not retry non-retryable kinds")
    void testDoesNotRetryValidationErrors() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();

        // Act
        EdgeException error = assertThrows(EdgeException.class, () -> retry.execute(() -> {
            calls.incrementAndGet();
            throw EdgeException.fromStatus(422, "unprocessable");
        }, RetryPolicy.defaults()));

        // Assert
        assertEquals(1, calls.get());
        assertEquals(ErrorKind.VALIDATION, error.getKind());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Should honour a per-instance retryable override")
    void testRetryableOverride() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(2, Duration.ofMillis(10), Duration.ofSeconds(1), 2.0);

        // Act
        String result = retry.execute(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new EdgeException(ErrorKind.UPSTREAM, "503", 503, Boolean.TRUE, null);
            }
            return "recovered";
        }, policy);

        // Assert
        assertEquals("recovered", result);
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("Should use a custom shouldRetry predicate")
    void testCustomPredicate() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(10), Duration.ofSeconds(1), 2.0)
                .withShouldRetry((error, attempt) -> attempt < 2);

        // Act
        assertThrows(EdgeException.class, () -> retry.execute(() -> {
            calls.incrementAndGet();
            throw new IOException("down");
        }, policy));

        // Assert
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("Should grow delays exponentially with 10-30% jitter, capped at maxDelay")
    void testBackoffDelays() {
        // Arrange
        RetryPolicy policy = new RetryPolicy(10, Duration.ofMillis(100), Duration.ofMillis(1000), 2.0);

        // Act & Assert
        long[] bases = {100, 200, 400, 800, 1000, 1000};
        for (int n = 0; n < bases.length; n++) {
            long delay = retry.computeDelay(policy, n).toMillis();
            assertTrue(delay >= Math.round(bases[n] * 1.1) - 1, "delay " + n + " too small: " + delay);
            assertTrue(delay <= Math.round(bases[n] * 1.3) + 1, "delay " + n + " too large: " + delay);
        }
    }

    @Test
    @DisplayName("Should reject invalid policies")
    void testInvalidPolicy() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(0, Duration.ofMillis(10), Duration.ofSeconds(1), 2.0));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(3, Duration.ofMillis(10), Duration.ofSeconds(1), 0.5));
    }
}
