package com.numaansystems.crmedge.resilience;

/**
 * Unchecked failure carrying an {@link ErrorKind}.
 *
 * <p>Retryability defaults to the kind's own setting and may be overridden per
 * instance, e.g. to mark a specific {@code 503} as safe to retry.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class EdgeException extends RuntimeException {

    private final ErrorKind kind;
    private final int status;
    private final Boolean retryableOverride;

    public EdgeException(ErrorKind kind, String message) {
        this(kind, message, 0, null, null);
    }

    public EdgeException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, 0, null, cause);
    }

    public EdgeException(ErrorKind kind, String message, int status, Boolean retryableOverride, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
        this.retryableOverride = retryableOverride;
    }

    /**
     * Builds an exception for a non-2xx upstream response.
     *
     * @param status the upstream status code
     * @param message description for logs
     * @return exception whose kind is derived from the status
     */
    public static EdgeException fromStatus(int status, String message) {
        return new EdgeException(ErrorKind.fromStatus(status), message, status, null, null);
    }

    /**
     * Wraps a checked or foreign exception, keeping {@code EdgeException}s and other
     * runtime exceptions as they are.
     */
    public static RuntimeException wrap(Throwable error) {
        if (error instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (error instanceof Error fatal) {
            throw fatal;
        }
        return new EdgeException(ErrorKind.of(error), error.getMessage(), error);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return the upstream HTTP status, or {@code 0} when the failure did not come from a response
     */
    public int getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return retryableOverride != null ? retryableOverride : kind.isRetryableByDefault();
    }

    public String getUserMessage() {
        return kind.getUserMessage();
    }
}
