package com.numaansystems.crmedge.broker;

import com.numaansystems.crmedge.resilience.EdgeException;
import com.numaansystems.crmedge.resilience.ErrorKind;

/**
 * The session's access token could not be renewed; the caller must sign in again.
 */
public class RefreshFailedException extends EdgeException {

    public RefreshFailedException(String message, Throwable cause) {
        super(ErrorKind.SESSION_EXPIRED, message, 0, Boolean.FALSE, cause);
    }
}
