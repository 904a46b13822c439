package com.numaansystems.crmedge.routing;

/**
 * Access class of a request path.
 */
public enum RouteClass {
    /** Served to everyone: marketing pages, the auth API, health. */
    PUBLIC,
    /** Login and signup pages; authenticated users are sent into the app. */
    GUEST_ONLY,
    /** The application area under {@code /app}. */
    PROTECTED,
    /** The onboarding wizard under {@code /onboarding}. */
    ONBOARDING
}
