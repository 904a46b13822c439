package com.numaansystems.crmedge.resilience;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Advisory timeouts for asynchronous and blocking operations.
 *
 * <p>The guarded operation is abandoned, not cancelled: when the timer wins, the
 * returned future fails with {@link EdgeTimeoutException} and a later completion of
 * the original operation is ignored.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public final class Timeouts {

    private Timeouts() {
    }

    /**
     * Races {@code operation} against a timer.
     *
     * @param operation the pending operation
     * @param timeout how long to wait
     * @param message message of the timeout failure
     * @return a future completing with the operation's outcome or a timeout failure
     */
    public static <T> CompletableFuture<T> withTimeout(CompletableFuture<T> operation, Duration timeout, String message) {
        CompletableFuture<T> result = new CompletableFuture<>();
        operation.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(value);
            }
        });

        Executor timer = CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        CompletableFuture.runAsync(() -> result.completeExceptionally(new EdgeTimeoutException(message, timeout)), timer);
        return result;
    }

    /**
     * Runs a blocking call on {@code executor} and waits at most {@code timeout} for it.
     *
     * @return the call's result
     * @throws EdgeTimeoutException when the call does not finish in time
     */
    public static <T> T call(Callable<T> operation, Duration timeout, String message, Executor executor) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return operation.call();
            } catch (Exception e) {
                throw new CompletionException(EdgeException.wrap(e));
            }
        }, executor);

        try {
            return withTimeout(future, timeout, message).join();
        } catch (CompletionException e) {
            throw EdgeException.wrap(unwrap(e));
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
