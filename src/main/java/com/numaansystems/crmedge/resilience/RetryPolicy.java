package com.numaansystems.crmedge.resilience;

import java.time.Duration;
import java.util.function.BiPredicate;

/**
 * Immutable settings for {@link Retry}.
 *
 * <p>{@code maxAttempts} counts the first call, so a policy of 3 performs at most
 * two retries. The default {@code shouldRetry} predicate retries failures whose
 * kind is retryable: network errors, timeouts and rate limiting.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public final class RetryPolicy {

    /** Retries whatever the error kind considers retryable. */
    public static final BiPredicate<Throwable, Integer> RETRYABLE_KINDS = (error, attempt) -> {
        if (error instanceof EdgeException edgeException) {
            return edgeException.isRetryable();
        }
        return ErrorKind.of(error).isRetryableByDefault();
    };

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double backoffMultiplier;
    private final BiPredicate<Throwable, Integer> shouldRetry;

    public RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, double backoffMultiplier) {
        this(maxAttempts, initialDelay, maxDelay, backoffMultiplier, RETRYABLE_KINDS);
    }

    public RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, double backoffMultiplier,
                       BiPredicate<Throwable, Integer> shouldRetry) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.backoffMultiplier = backoffMultiplier;
        this.shouldRetry = shouldRetry != null ? shouldRetry : RETRYABLE_KINDS;
    }

    /**
     * 3 attempts, 1s initial delay, 30s cap, doubling.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0);
    }

    public RetryPolicy withShouldRetry(BiPredicate<Throwable, Integer> predicate) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, backoffMultiplier, predicate);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public BiPredicate<Throwable, Integer> getShouldRetry() {
        return shouldRetry;
    }
}
