package com.numaansystems.crmedge.resilience;

/**
 * Outcome of {@link GracefulDegradation#execute}: live data, or cached data
 * flagged as stale together with the failure that forced the fallback.
 */
public final class DegradedResult<T> {

    private final T data;
    private final boolean stale;
    private final Throwable error;

    private DegradedResult(T data, boolean stale, Throwable error) {
        this.data = data;
        this.stale = stale;
        this.error = error;
    }

    public static <T> DegradedResult<T> fresh(T data) {
        return new DegradedResult<>(data, false, null);
    }

    public static <T> DegradedResult<T> stale(T data, Throwable error) {
        return new DegradedResult<>(data, true, error);
    }

    public T getData() {
        return data;
    }

    public boolean isStale() {
        return stale;
    }

    /**
     * @return the fetch failure when {@link #isStale()}, otherwise {@code null}
     */
    public Throwable getError() {
        return error;
    }
}
