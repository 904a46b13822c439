package com.numaansystems.crmedge.session;

/**
 * Outcome of reading the session cookie of one request.
 *
 * <p>Three cases: no cookie at all, a cookie that failed verification, or a verified
 * session. Callers use {@link #hadInvalidCookie()} to clear stale cookies and mark
 * redirects with {@code error=session_expired}.</p>
 */
public final class SessionLookup {

    private static final SessionLookup ANONYMOUS = new SessionLookup(null, null);

    private final SessionPayload payload;
    private final VerificationFailure failure;

    private SessionLookup(SessionPayload payload, VerificationFailure failure) {
        this.payload = payload;
        this.failure = failure;
    }

    public static SessionLookup anonymous() {
        return ANONYMOUS;
    }

    public static SessionLookup invalidCookie(VerificationFailure failure) {
        return new SessionLookup(null, failure);
    }

    public static SessionLookup authenticated(SessionPayload payload) {
        return new SessionLookup(payload, null);
    }

    public boolean isAuthenticated() {
        return payload != null;
    }

    public boolean hadInvalidCookie() {
        return failure != null;
    }

    public SessionPayload getPayload() {
        return payload;
    }

    public VerificationFailure getFailure() {
        return failure;
    }
}
