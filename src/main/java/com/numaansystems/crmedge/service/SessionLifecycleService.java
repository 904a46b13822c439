package com.numaansystems.crmedge.service;

import com.numaansystems.crmedge.broker.AccessTokenInspector;
import com.numaansystems.crmedge.broker.BrokeredSession;
import com.numaansystems.crmedge.broker.CredentialBroker;
import com.numaansystems.crmedge.broker.RefreshFailedException;
import com.numaansystems.crmedge.broker.UpstreamAuthClient;
import com.numaansystems.crmedge.broker.UpstreamLoginResponse;
import com.numaansystems.crmedge.broker.UpstreamRegisterResponse;
import com.numaansystems.crmedge.broker.UpstreamStatusException;
import com.numaansystems.crmedge.config.EdgeProperties;
import com.numaansystems.crmedge.config.UpstreamConfig;
import com.numaansystems.crmedge.resilience.CircuitOpenException;
import com.numaansystems.crmedge.resilience.EdgeException;
import com.numaansystems.crmedge.resilience.ErrorKind;
import com.numaansystems.crmedge.routing.OnboardingRouter;
import com.numaansystems.crmedge.session.OnboardingState;
import com.numaansystems.crmedge.session.OnboardingStatus;
import com.numaansystems.crmedge.session.SessionCookieService;
import com.numaansystems.crmedge.session.SessionLookup;
import com.numaansystems.crmedge.session.SessionPayload;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Creates and ends browser sessions.
 *
 * <h2>Login</h2>
 * <p>Credentials are checked by the upstream API. The first tenant of the user becomes
 * the session tenant; onboarding claims come from the upstream answer, defaulting to a
 * fresh onboarding. The response tells the browser where to go next.</p>
 *
 * <h2>Registration</h2>
 * <p>Creates the upstream account only. No cookie is issued; the user signs in once the
 * email address is confirmed.</p>
 *
 * <h2>Refresh</h2>
 * <p>Rotates the backend tokens on demand. A refresh the upstream rejects ends the session
 * and clears the cookie; an unreachable upstream leaves the cookie in place so the
 * client can try again.</p>
 *
 * <h2>Tenant switch</h2>
 * <p>Re-issues the session for another tenant of the same user, with the role the
 * upstream reports for that tenant. Identity, tokens and onboarding claims carry over.</p>
 *
 * <h2>Logout</h2>
 * <p>The upstream session is revoked on a best-effort basis; the cookie is always cleared.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class SessionLifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(SessionLifecycleService.class);

    static final String STEP_BRANDING = "branding";
    static final String DEFAULT_ROLE = "viewer";
    static final long DEFAULT_EXPIRES_IN_SECONDS = 900;

    private final UpstreamAuthClient upstreamAuthClient;
    private final CredentialBroker credentialBroker;
    private final SessionCookieService sessionCookieService;
    private final String defaultAppPath;
    private final Clock clock;

    public SessionLifecycleService(UpstreamAuthClient upstreamAuthClient,
                                   CredentialBroker credentialBroker,
                                   SessionCookieService sessionCookieService,
                                   EdgeProperties properties,
                                   Clock clock) {
        this.upstreamAuthClient = upstreamAuthClient;
        this.credentialBroker = credentialBroker;
        this.sessionCookieService = sessionCookieService;
        this.defaultAppPath = properties.getRouting().getDefaultAppPath();
        this.clock = clock;
    }

    /**
     * Authenticates upstream and issues the session cookie.
     *
     * @return the path the browser should navigate to
     */
    public String login(String email, String password, HttpServletResponse response) {
        UpstreamLoginResponse login = upstreamAuthClient.login(email, password);
        if (login == null || login.user == null || login.user.id == null
                || login.session == null || login.session.accessToken == null) {
            throw new EdgeException(ErrorKind.UPSTREAM, "Upstream login response is incomplete");
        }

        UpstreamLoginResponse.TenantMembership tenant =
                login.tenants != null && !login.tenants.isEmpty() ? login.tenants.get(0) : null;
        boolean hasTenant = tenant != null && tenant.id != null && !tenant.id.isEmpty();

        SessionPayload.Builder builder = SessionPayload.builder()
                .userId(login.user.id)
                .email(login.user.email != null ? login.user.email : email)
                .tenantId(hasTenant ? tenant.id : "")
                .role(tenant != null && tenant.role != null ? tenant.role : DEFAULT_ROLE)
                .accessToken(login.session.accessToken)
                .refreshToken(login.session.refreshToken)
                .accessTokenExpiresAt(accessTokenExpiry(login.session))
                .onboardingStatus(onboardingStatus(login.onboarding))
                .onboardingStep(onboardingStep(login.onboarding, hasTenant))
                .requiresOnboarding(login.onboarding != null && login.onboarding.requiresOnboarding != null
                        ? login.onboarding.requiresOnboarding
                        : Boolean.TRUE);

        SessionPayload payload = sessionCookieService.start(response, builder);
        OnboardingState state = payload.onboardingState();
        String redirectTo = OnboardingRouter.resolveDestination(state, payload.hasTenant(), null, defaultAppPath);
        logger.info("User {} logged in, onboarding {} at step {}, redirecting to {}",
                payload.getUserId(), state.getStatus().getValue(), state.getCurrentStep(), redirectTo);
        return redirectTo;
    }

    /**
     * Registers a new account upstream without starting a session.
     *
     * @return whether the user has to confirm the email address before signing in
     * @throws UpstreamStatusException when the upstream rejects the registration
     */
    public boolean register(String email, String password, String fullName) {
        UpstreamRegisterResponse registration = upstreamAuthClient.register(email, password, fullName);
        boolean confirmationRequired = registration.isConfirmationRequired();
        logger.info("Account registered{}", confirmationRequired ? ", email confirmation pending" : "");
        return confirmationRequired;
    }

    /**
     * Rotates the backend tokens of the caller's session and rewrites the cookie.
     *
     * @return the rotated session
     * @throws EdgeException {@code UNAUTHORIZED}/{@code SESSION_EXPIRED} without a session,
     *         the upstream failure when the upstream could not be reached
     * @throws RefreshFailedException when the upstream rejected the refresh; the cookie is cleared
     */
    public SessionPayload refresh(HttpServletRequest request, HttpServletResponse response) {
        SessionPayload payload = requireSession(request);
        SessionPayload rotated;
        try {
            rotated = credentialBroker.refreshNow(payload);
        } catch (RefreshFailedException e) {
            if (isInfrastructureFailure(e.getCause())) {
                throw (EdgeException) e.getCause();
            }
            sessionCookieService.clear(response);
            logger.info("Session of user {} ended after a rejected refresh", payload.getUserId());
            throw e;
        }
        sessionCookieService.issue(response, rotated);
        return rotated;
    }

    /**
     * Moves the caller's session to {@code tenantId}.
     *
     * @return the re-issued session
     * @throws EdgeException {@code FORBIDDEN} when the upstream refuses the tenant
     */
    public SessionPayload switchTenant(String tenantId, HttpServletRequest request, HttpServletResponse response) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new EdgeException(ErrorKind.VALIDATION, "Tenant switch without a tenant id");
        }
        BrokeredSession brokered = credentialBroker.ensureFreshCredentials(requireSession(request));
        SessionPayload payload = brokered.getPayload();

        String role;
        try {
            role = upstreamAuthClient.fetchTenantRole(payload.getAccessToken(), tenantId);
        } catch (UpstreamStatusException e) {
            if (e.getStatus() >= 500) {
                throw e;
            }
            logger.warn("User {} may not switch to tenant {}: HTTP {}", payload.getUserId(), tenantId, e.getStatus());
            throw new EdgeException(ErrorKind.FORBIDDEN, "Tenant switch refused by upstream", e);
        }

        SessionPayload switched = payload.toBuilder()
                .tenantId(tenantId)
                .role(role != null ? role : DEFAULT_ROLE)
                .build();
        sessionCookieService.issue(response, switched);
        logger.info("User {} switched to tenant {} as {}", switched.getUserId(), tenantId, switched.getRole());
        return switched;
    }

    /**
     * Where a signed-in user should land, per the onboarding rules.
     */
    public String destinationFor(SessionPayload payload) {
        return OnboardingRouter.resolveDestination(payload.onboardingState(), payload.hasTenant(), null, defaultAppPath);
    }

    /**
     * Ends the caller's session, if any.
     */
    public void logout(HttpServletRequest request, HttpServletResponse response) {
        SessionLookup session = sessionCookieService.lookup(request);
        if (session.isAuthenticated()) {
            upstreamAuthClient.logout(session.getPayload().getAccessToken());
            logger.info("User {} logged out", session.getPayload().getUserId());
        }
        sessionCookieService.clear(response);
    }

    private SessionPayload requireSession(HttpServletRequest request) {
        SessionLookup session = sessionCookieService.lookup(request);
        if (session.isAuthenticated()) {
            return session.getPayload();
        }
        throw new EdgeException(
                session.hadInvalidCookie() ? ErrorKind.SESSION_EXPIRED : ErrorKind.UNAUTHORIZED,
                "No valid session");
    }

    private static boolean isInfrastructureFailure(Throwable cause) {
        return cause instanceof CircuitOpenException
                || cause instanceof EdgeException edgeException
                && UpstreamConfig.INFRASTRUCTURE_FAILURES.contains(edgeException.getKind());
    }

    private long accessTokenExpiry(UpstreamLoginResponse.Tokens tokens) {
        if (tokens.expiresAt != null && tokens.expiresAt > 0) {
            return tokens.expiresAt;
        }
        return AccessTokenInspector.unverifiedExpiry(tokens.accessToken)
                .orElseGet(() -> clock.instant().getEpochSecond()
                        + (tokens.expiresIn != null && tokens.expiresIn > 0 ? tokens.expiresIn : DEFAULT_EXPIRES_IN_SECONDS));
    }

    private static OnboardingStatus onboardingStatus(UpstreamLoginResponse.Onboarding onboarding) {
        if (onboarding == null) {
            return OnboardingStatus.NOT_STARTED;
        }
        return OnboardingStatus.fromValue(onboarding.status).orElse(OnboardingStatus.NOT_STARTED);
    }

    private static String onboardingStep(UpstreamLoginResponse.Onboarding onboarding, boolean hasTenant) {
        if (onboarding != null && onboarding.currentStep != null && !onboarding.currentStep.isEmpty()) {
            return onboarding.currentStep;
        }
        return hasTenant ? STEP_BRANDING : OnboardingState.STEP_CREATE_BUSINESS;
    }
}
