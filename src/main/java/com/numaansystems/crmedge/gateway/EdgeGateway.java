package com.numaansystems.crmedge.gateway;

import com.numaansystems.crmedge.config.EdgeProperties;
import com.numaansystems.crmedge.routing.OnboardingRouter;
import com.numaansystems.crmedge.routing.RouteClass;
import com.numaansystems.crmedge.routing.RouteClassifier;
import com.numaansystems.crmedge.session.OnboardingState;
import com.numaansystems.crmedge.session.SessionLookup;
import com.numaansystems.crmedge.session.SessionPayload;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Routing policy of the edge: given a path and the caller's session, forward or redirect.
 *
 * <h2>Route classes</h2>
 * <ul>
 *   <li><b>Public</b>: always served; an authenticated visitor of {@code /} is sent to
 *       their resolved destination.</li>
 *   <li><b>Guest-only</b>: served (cacheable) to anonymous users; authenticated users are
 *       sent to the resolved destination, honouring a local {@code redirect} parameter.</li>
 *   <li><b>Protected</b>: anonymous users go to login with the path as {@code redirect};
 *       a rejected cookie is cleared and marked with {@code error=session_expired}.
 *       Users with onboarding pending go to their onboarding step.</li>
 *   <li><b>Onboarding</b>: anonymous users go to signup; users who finished onboarding go
 *       to the app.</li>
 * </ul>
 *
 * <p>This class does no I/O; {@link EdgeGatewayFilter} applies its decisions.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class EdgeGateway {

    static final String LOGIN_PATH = "/login";
    static final String SIGNUP_PATH = "/signup";
    static final String GUEST_CACHE_CONTROL = "public, max-age=60";
    static final String SESSION_EXPIRED_MARKER = "error=session_expired";

    private final String defaultAppPath;

    public EdgeGateway(EdgeProperties properties) {
        this.defaultAppPath = properties.getRouting().getDefaultAppPath();
    }

    /**
     * @param path request path, without context path or query
     * @param redirectParam value of the {@code redirect} query parameter, may be {@code null}
     * @param session outcome of reading the session cookie
     */
    public GatewayDecision decide(String path, String redirectParam, SessionLookup session) {
        RouteClass routeClass = RouteClassifier.classify(path);
        return switch (routeClass) {
            case PUBLIC -> decidePublic(path, session);
            case GUEST_ONLY -> decideGuestOnly(redirectParam, session);
            case PROTECTED -> decideProtected(path, session);
            case ONBOARDING -> decideOnboarding(path, session);
        };
    }

    private GatewayDecision decidePublic(String path, SessionLookup session) {
        if (session.isAuthenticated() && "/".equals(path)) {
            return GatewayDecision.redirect(destination(session.getPayload(), null), session);
        }
        return GatewayDecision.forward(session);
    }

    private GatewayDecision decideGuestOnly(String redirectParam, SessionLookup session) {
        if (!session.isAuthenticated()) {
            return GatewayDecision.forwardCacheable(session, GUEST_CACHE_CONTROL);
        }
        String intended = isLocalPath(redirectParam) ? redirectParam : defaultAppPath;
        return GatewayDecision.redirect(destination(session.getPayload(), intended), session);
    }

    private GatewayDecision decideProtected(String path, SessionLookup session) {
        if (!session.isAuthenticated()) {
            String location = LOGIN_PATH + "?redirect=" + URLEncoder.encode(path, StandardCharsets.UTF_8);
            if (session.hadInvalidCookie()) {
                return GatewayDecision.redirectClearingCookie(location + "&" + SESSION_EXPIRED_MARKER, session);
            }
            return GatewayDecision.redirect(location, session);
        }

        SessionPayload payload = session.getPayload();
        OnboardingState state = payload.onboardingState();
        if (state.needsOnboarding()) {
            return GatewayDecision.redirect(destination(payload, path), session);
        }
        if (!payload.hasTenant()) {
            return GatewayDecision.redirect(OnboardingRouter.CREATE_BUSINESS_PATH, session);
        }
        return GatewayDecision.forward(session);
    }

    private GatewayDecision decideOnboarding(String path, SessionLookup session) {
        if (!session.isAuthenticated()) {
            if (session.hadInvalidCookie()) {
                return GatewayDecision.redirectClearingCookie(SIGNUP_PATH, session);
            }
            return GatewayDecision.redirect(SIGNUP_PATH, session);
        }

        SessionPayload payload = session.getPayload();
        OnboardingState state = payload.onboardingState();
        if (!state.needsOnboarding() && payload.hasTenant()) {
            return GatewayDecision.redirect(defaultAppPath, session);
        }
        if (payload.hasTenant() && isCreateBusiness(path)) {
            return GatewayDecision.redirect(OnboardingRouter.nextStepAfterBusinessCreation(state), session);
        }
        return GatewayDecision.forward(session);
    }

    private String destination(SessionPayload payload, String intendedPath) {
        return OnboardingRouter.resolveDestination(
                payload.onboardingState(), payload.hasTenant(), intendedPath, defaultAppPath);
    }

    private static boolean isCreateBusiness(String path) {
        return path.equals(OnboardingRouter.CREATE_BUSINESS_PATH)
                || path.startsWith(OnboardingRouter.CREATE_BUSINESS_PATH + "/");
    }

    /**
     * Only same-origin absolute paths are accepted as redirect targets.
     */
    static boolean isLocalPath(String candidate) {
        if (candidate == null || candidate.isEmpty() || candidate.charAt(0) != '/') {
            return false;
        }
        if (candidate.length() > 1 && (candidate.charAt(1) == '/' || candidate.charAt(1) == '\\')) {
            return false;
        }
        return candidate.indexOf('\r') < 0 && candidate.indexOf('\n') < 0;
    }
}
