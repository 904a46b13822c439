package com.numaansystems.crmedge.gateway;

import com.numaansystems.crmedge.session.SessionLookup;

/**
 * What the edge filter does with one request.
 */
public final class GatewayDecision {

    public enum Action {
        FORWARD,
        REDIRECT
    }

    private final Action action;
    private final String location;
    private final boolean clearCookie;
    private final String cacheControl;
    private final SessionLookup session;

    private GatewayDecision(Action action, String location, boolean clearCookie,
                            String cacheControl, SessionLookup session) {
        this.action = action;
        this.location = location;
        this.clearCookie = clearCookie;
        this.cacheControl = cacheControl;
        this.session = session;
    }

    public static GatewayDecision forward(SessionLookup session) {
        return new GatewayDecision(Action.FORWARD, null, false, null, session);
    }

    public static GatewayDecision forwardCacheable(SessionLookup session, String cacheControl) {
        return new GatewayDecision(Action.FORWARD, null, false, cacheControl, session);
    }

    public static GatewayDecision redirect(String location, SessionLookup session) {
        return new GatewayDecision(Action.REDIRECT, location, false, null, session);
    }

    public static GatewayDecision redirectClearingCookie(String location, SessionLookup session) {
        return new GatewayDecision(Action.REDIRECT, location, true, null, session);
    }

    public Action getAction() {
        return action;
    }

    public boolean isRedirect() {
        return action == Action.REDIRECT;
    }

    public String getLocation() {
        return location;
    }

    public boolean isClearCookie() {
        return clearCookie;
    }

    /**
     * @return the {@code Cache-Control} value to set, or {@code null}
     */
    public String getCacheControl() {
        return cacheControl;
    }

    public SessionLookup getSession() {
        return session;
    }

    @Override
    public String toString() {
        return isRedirect() ? "REDIRECT " + location + (clearCookie ? " (clear cookie)" : "") : "FORWARD";
    }
}
