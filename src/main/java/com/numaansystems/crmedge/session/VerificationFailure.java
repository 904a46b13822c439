package com.numaansystems.crmedge.session;

/**
 * Reasons a session token is rejected by {@link SessionCodec#verify(String)}.
 */
public enum VerificationFailure {
    /** No token was presented. */
    MISSING,
    MALFORMED,
    BAD_SIGNATURE,
    /** Not HS256, or not signed at all. */
    UNSUPPORTED_ALGORITHM,
    /** The token's own {@code exp} has passed. */
    EXPIRED,
    /** The payload's {@code expiresAt} has passed although {@code exp} has not. */
    SESSION_EXPIRED,
    MISSING_USER_ID
}
