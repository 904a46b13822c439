package com.numaansystems.crmedge.resilience;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * Classification of failures seen by the edge gateway and its outbound clients.
 *
 * <p>Each kind carries a default retryability and the message shown to end users
 * when every attempt has been exhausted. Raw exception text is never shown to users.</p>
 *
 * <h2>Retryable by default</h2>
 * <ul>
 *   <li>{@link #NETWORK}</li>
 *   <li>{@link #TIMEOUT}</li>
 *   <li>{@link #RATE_LIMITED}</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public enum ErrorKind {

    NETWORK(true, "Unable to reach the server. Check your connection and try again."),
    TIMEOUT(true, "The server took too long to respond. Please try again."),
    OFFLINE(false, "You appear to be offline. Reconnect and try again."),
    UPSTREAM(false, "The service is temporarily unavailable. Please try again later."),
    VALIDATION(false, "Some of the information provided is not valid."),
    NOT_FOUND(false, "The requested resource could not be found."),
    CONFLICT(false, "This record was changed by someone else. Refresh and try again."),
    RATE_LIMITED(true, "Too many requests. Please wait a moment and try again."),
    UNAUTHORIZED(false, "Please sign in to continue."),
    FORBIDDEN(false, "You do not have permission to perform this action."),
    SESSION_EXPIRED(false, "Your session has expired. Please sign in again."),
    INVALID_INPUT(false, "The request could not be processed. Check the input and try again."),
    STATE(false, "This action is not available right now."),
    UNKNOWN(false, "Something went wrong. Please try again.");

    private final boolean retryableByDefault;
    private final String userMessage;

    ErrorKind(boolean retryableByDefault, String userMessage) {
        this.retryableByDefault = retryableByDefault;
        this.userMessage = userMessage;
    }

    public boolean isRetryableByDefault() {
        return retryableByDefault;
    }

    public String getUserMessage() {
        return userMessage;
    }

    /**
     * Maps an HTTP status returned by the upstream API to an error kind.
     *
     * @param status the HTTP status code
     * @return the matching kind, {@link #UNKNOWN} for unrecognised codes
     */
    public static ErrorKind fromStatus(int status) {
        return switch (status) {
            case 400, 422 -> VALIDATION;
            case 401 -> UNAUTHORIZED;
            case 403 -> FORBIDDEN;
            case 404 -> NOT_FOUND;
            case 408, 504 -> TIMEOUT;
            case 409 -> CONFLICT;
            case 429 -> RATE_LIMITED;
            default -> status >= 500 ? UPSTREAM : UNKNOWN;
        };
    }

    /**
     * Classifies an arbitrary throwable.
     *
     * @param error the failure
     * @return the kind carried by an {@link EdgeException}, or one inferred from the exception type
     */
    public static ErrorKind of(Throwable error) {
        if (error instanceof EdgeException edgeException) {
            return edgeException.getKind();
        }
        if (error instanceof TimeoutException || error instanceof SocketTimeoutException) {
            return TIMEOUT;
        }
        if (error instanceof UnknownHostException) {
            return OFFLINE;
        }
        if (error instanceof ConnectException) {
            return NETWORK;
        }
        if (error instanceof InterruptedIOException) {
            return TIMEOUT;
        }
        if (error instanceof IOException) {
            return NETWORK;
        }
        if (error instanceof IllegalArgumentException) {
            return INVALID_INPUT;
        }
        if (error instanceof IllegalStateException) {
            return STATE;
        }
        return UNKNOWN;
    }
}
