package com.numaansystems.crmedge.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * Retry-with-exponential-backoff executor.
 *
 * <p>The delay before retry {@code n} (zero based) is
 * {@code min(initialDelay * multiplier^n, maxDelay)} plus 10-30% random jitter.
 * The last failure is rethrown once attempts are exhausted or the policy's
 * {@code shouldRetry} predicate declines; checked exceptions are wrapped in
 * {@link EdgeException} with their inferred {@link ErrorKind}.</p>
 *
 * <p>Instances hold no per-call state and may be shared between threads.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class Retry {

    private static final Logger logger = LoggerFactory.getLogger(Retry.class);

    /**
     * Blocks the calling thread between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration delay) throws InterruptedException;
    }

    private final Sleeper sleeper;
    private final Random random;

    public Retry() {
        this(delay -> Thread.sleep(delay.toMillis()), new Random());
    }

    public Retry(Sleeper sleeper, Random random) {
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * Invokes {@code operation} until it succeeds or the policy gives up.
     *
     * @param operation the call to attempt
     * @param policy attempt count, delays and retry predicate
     * @return the first successful result
     */
    public <T> T execute(Callable<T> operation, RetryPolicy policy) {
        int attempt = 1;
        while (true) {
            try {
                return operation.call();
            } catch (Exception e) {
                boolean lastAttempt = attempt >= policy.getMaxAttempts();
                if (lastAttempt || !policy.getShouldRetry().test(e, attempt)) {
                    if (lastAttempt && policy.getMaxAttempts() > 1) {
                        logger.warn("Giving up after {} attempts: {}", attempt, e.getMessage());
                    }
                    throw EdgeException.wrap(e);
                }

                Duration delay = computeDelay(policy, attempt - 1);
                logger.debug("Attempt {}/{} failed ({}), retrying in {} ms",
                        attempt, policy.getMaxAttempts(), e.getMessage(), delay.toMillis());
                pause(delay);
                attempt++;
            }
        }
    }

    /**
     * Computes the backoff delay, including jitter, for the given zero-based retry index.
     */
    Duration computeDelay(RetryPolicy policy, int retryIndex) {
        double base = policy.getInitialDelay().toMillis() * Math.pow(policy.getBackoffMultiplier(), retryIndex);
        double capped = Math.min(base, policy.getMaxDelay().toMillis());
        double jitter = capped * (0.1 + random.nextDouble() * 0.2);
        return Duration.ofMillis(Math.round(capped + jitter));
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EdgeException(ErrorKind.STATE, "Retry interrupted", e);
        }
    }
}
