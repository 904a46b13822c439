package com.numaansystems.crmedge.routing;

import java.util.List;

/**
 * Classifies request paths against static prefix tables.
 *
 * <p>A path matches a prefix when it equals it or continues it with {@code /},
 * so {@code /application} is not under {@code /app}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public final class RouteClassifier {

    static final List<String> GUEST_ONLY_PREFIXES = List.of(
            "/login",
            "/register",
            "/signup",
            "/forgot-password"
    );

    static final String PROTECTED_PREFIX = "/app";
    static final String ONBOARDING_PREFIX = "/onboarding";

    static final List<String> STATIC_ASSET_PREFIXES = List.of(
            "/_next",
            "/favicon.ico",
            "/images",
            "/fonts",
            "/static"
    );

    private RouteClassifier() {
    }

    public static RouteClass classify(String path) {
        String normalized = normalize(path);
        if (matchesAny(normalized, GUEST_ONLY_PREFIXES)) {
            return RouteClass.GUEST_ONLY;
        }
        if (matches(normalized, ONBOARDING_PREFIX)) {
            return RouteClass.ONBOARDING;
        }
        if (matches(normalized, PROTECTED_PREFIX)) {
            return RouteClass.PROTECTED;
        }
        return RouteClass.PUBLIC;
    }

    /**
     * Static assets bypass the gateway entirely.
     */
    public static boolean isStaticAsset(String path) {
        return matchesAny(normalize(path), STATIC_ASSET_PREFIXES);
    }

    /**
     * @return true for {@code /app} and anything below it
     */
    public static boolean isAppPath(String path) {
        return path != null && matches(path, PROTECTED_PREFIX);
    }

    static boolean matches(String path, String prefix) {
        return path.equals(prefix) || path.startsWith(prefix + "/");
    }

    private static boolean matchesAny(String path, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (matches(path, prefix)) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        return path;
    }
}
