package com.numaansystems.crmedge.broker;

import com.numaansystems.crmedge.session.SessionPayload;

/**
 * Session whose access token is fresh enough to forward, and whether it was rotated
 * (in which case the session cookie must be rewritten).
 */
public final class BrokeredSession {

    private final SessionPayload payload;
    private final boolean rotated;

    private BrokeredSession(SessionPayload payload, boolean rotated) {
        this.payload = payload;
        this.rotated = rotated;
    }

    public static BrokeredSession unchanged(SessionPayload payload) {
        return new BrokeredSession(payload, false);
    }

    public static BrokeredSession rotated(SessionPayload payload) {
        return new BrokeredSession(payload, true);
    }

    public SessionPayload getPayload() {
        return payload;
    }

    public boolean isRotated() {
        return rotated;
    }
}
