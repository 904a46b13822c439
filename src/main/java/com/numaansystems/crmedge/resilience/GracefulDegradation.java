package com.numaansystems.crmedge.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Serves the last known good value when a live fetch fails.
 *
 * <p>The cache itself belongs to the caller, which supplies read and write
 * callbacks. Without a cached value the original failure is rethrown.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public final class GracefulDegradation {

    private static final Logger logger = LoggerFactory.getLogger(GracefulDegradation.class);

    private GracefulDegradation() {
    }

    public static <T> DegradedResult<T> execute(Callable<T> fetch,
                                                Supplier<Optional<T>> getCached,
                                                Consumer<T> setCached) {
        T data;
        try {
            data = fetch.call();
        } catch (Exception e) {
            Optional<T> cached = getCached.get();
            if (cached.isPresent()) {
                logger.warn("Live fetch failed ({}), serving cached data", e.getMessage());
                return DegradedResult.stale(cached.get(), e);
            }
            throw EdgeException.wrap(e);
        }
        setCached.accept(data);
        return DegradedResult.fresh(data);
    }
}
