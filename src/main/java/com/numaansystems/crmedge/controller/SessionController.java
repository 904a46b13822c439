package com.numaansystems.crmedge.controller;

import com.numaansystems.crmedge.broker.TenantDetails;
import com.numaansystems.crmedge.broker.UpstreamStatusException;
import com.numaansystems.crmedge.resilience.DegradedResult;
import com.numaansystems.crmedge.resilience.EdgeException;
import com.numaansystems.crmedge.resilience.ErrorKind;
import com.numaansystems.crmedge.service.SessionLifecycleService;
import com.numaansystems.crmedge.service.TenantDetailsService;
import com.numaansystems.crmedge.session.OnboardingState;
import com.numaansystems.crmedge.session.SessionCookieService;
import com.numaansystems.crmedge.session.SessionLookup;
import com.numaansystems.crmedge.session.SessionPayload;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Session lifecycle endpoints used by the single-page application.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>{@code POST /api/auth/login}: sign in, set the session cookie, return {@code redirectTo}</li>
 *   <li>{@code POST /api/auth/register}: create an account; no session until the email is confirmed</li>
 *   <li>{@code POST /api/auth/refresh}: rotate the backend tokens and rewrite the cookie</li>
 *   <li>{@code POST /api/auth/switch-tenant}: re-issue the session for another tenant</li>
 *   <li>{@code POST /api/auth/logout}: revoke upstream (best effort), clear the cookie</li>
 *   <li>{@code GET /api/auth/session}: the signed-in user, without tokens</li>
 *   <li>{@code GET /api/auth/tenant}: details of the current tenant, possibly stale</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestController
@RequestMapping("/api/auth")
public class SessionController {

    private static final Logger logger = LoggerFactory.getLogger(SessionController.class);

    static final String EMAIL_NOT_CONFIRMED = "EMAIL_NOT_CONFIRMED";

    private final SessionLifecycleService sessionLifecycleService;
    private final SessionCookieService sessionCookieService;
    private final TenantDetailsService tenantDetailsService;

    public SessionController(SessionLifecycleService sessionLifecycleService,
                             SessionCookieService sessionCookieService,
                             TenantDetailsService tenantDetailsService) {
        this.sessionLifecycleService = sessionLifecycleService;
        this.sessionCookieService = sessionCookieService;
        this.tenantDetailsService = tenantDetailsService;
    }

    /**
     * Credentials posted by the login form.
     */
    public static class LoginRequest {
        public String email;
        public String password;
    }

    @PostMapping("/login")
    public ResponseEntity<Map<String, Object>> login(@RequestBody LoginRequest loginRequest,
                                                     HttpServletResponse response) {
        if (loginRequest == null || !isEmail(loginRequest.email)
                || loginRequest.password == null || loginRequest.password.isEmpty()) {
            throw new EdgeException(ErrorKind.VALIDATION, "Login request without a valid email and password");
        }

        String redirectTo;
        try {
            redirectTo = sessionLifecycleService.login(loginRequest.email.trim(), loginRequest.password, response);
        } catch (UpstreamStatusException e) {
            if (e.getStatus() >= 500) {
                throw e;
            }
            return loginRejected(e);
        }

        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        body.put("redirectTo", redirectTo);
        return ResponseEntity.ok(body);
    }

    /**
     * Sign-up form.
     */
    public static class RegisterRequest {
        public String email;
        public String password;
        public String fullName;
    }

    @PostMapping("/register")
    public ResponseEntity<Map<String, Object>> register(@RequestBody RegisterRequest registerRequest) {
        String problem = registrationProblem(registerRequest);
        if (problem != null) {
            logger.debug("Registration rejected: {}", problem);
            return failure(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION.name(), problem);
        }

        String fullName = registerRequest.fullName != null ? registerRequest.fullName.trim() : null;
        boolean confirmationRequired;
        try {
            confirmationRequired = sessionLifecycleService.register(
                    registerRequest.email.trim(), registerRequest.password, fullName);
        } catch (UpstreamStatusException e) {
            if (e.getStatus() >= 500) {
                throw e;
            }
            logger.warn("Registration rejected by upstream with HTTP {}", e.getStatus());
            HttpStatus status = HttpStatus.resolve(e.getStatus());
            return failure(status != null ? status : HttpStatus.BAD_REQUEST,
                    e.getUpstreamCode() != null ? e.getUpstreamCode() : e.getKind().name(),
                    e.getUpstreamMessage() != null ? e.getUpstreamMessage() : "Registration failed");
        }

        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        body.put("confirmationRequired", confirmationRequired);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/refresh")
    public ResponseEntity<Map<String, Object>> refresh(HttpServletRequest request, HttpServletResponse response) {
        SessionPayload rotated = sessionLifecycleService.refresh(request, response);

        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        body.put("accessTokenExpiresAt", rotated.getAccessTokenExpiresAt());
        return ResponseEntity.ok(body);
    }

    /**
     * Target of a tenant switch.
     */
    public static class SwitchTenantRequest {
        public String tenantId;
    }

    @PostMapping("/switch-tenant")
    public ResponseEntity<Map<String, Object>> switchTenant(@RequestBody SwitchTenantRequest switchRequest,
                                                            HttpServletRequest request,
                                                            HttpServletResponse response) {
        SessionPayload switched = sessionLifecycleService.switchTenant(
                switchRequest != null ? switchRequest.tenantId : null, request, response);

        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        body.put("tenantId", switched.getTenantId());
        body.put("role", switched.getRole());
        body.put("redirectTo", sessionLifecycleService.destinationFor(switched));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, Object>> logout(HttpServletRequest request, HttpServletResponse response) {
        sessionLifecycleService.logout(request, response);

        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        body.put("redirectTo", "/login");
        return ResponseEntity.ok(body);
    }

    @GetMapping("/session")
    public ResponseEntity<Map<String, Object>> session(HttpServletRequest request) {
        SessionPayload payload = requireSession(request);
        OnboardingState state = payload.onboardingState();

        Map<String, Object> onboarding = new HashMap<>();
        onboarding.put("status", state.getStatus().getValue());
        onboarding.put("currentStep", state.getCurrentStep());
        onboarding.put("requiresOnboarding", state.isRequiresOnboarding());

        Map<String, Object> body = new HashMap<>();
        body.put("userId", payload.getUserId());
        body.put("email", payload.getEmail());
        body.put("tenantId", payload.getTenantId());
        body.put("role", payload.getRole());
        body.put("permissions", payload.getPermissions());
        body.put("expiresAt", payload.getSessionExpiresAt());
        body.put("onboarding", onboarding);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/tenant")
    public ResponseEntity<Map<String, Object>> tenant(HttpServletRequest request) {
        SessionPayload payload = requireSession(request);

        Map<String, Object> body = new HashMap<>();
        if (!payload.hasTenant()) {
            body.put("tenant", null);
            body.put("stale", false);
            return ResponseEntity.ok(body);
        }

        DegradedResult<TenantDetails> result = tenantDetailsService.currentTenant(payload);
        body.put("tenant", result.getData());
        body.put("stale", result.isStale());
        return ResponseEntity.ok(body);
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

    private ResponseEntity<Map<String, Object>> loginRejected(UpstreamStatusException e) {
        boolean unconfirmed = EMAIL_NOT_CONFIRMED.equals(e.getUpstreamCode());
        logger.warn("Login rejected by upstream with HTTP {}{}", e.getStatus(), unconfirmed ? " (email not confirmed)" : "");

        return failure(HttpStatus.UNAUTHORIZED,
                e.getUpstreamCode() != null ? e.getUpstreamCode() : ErrorKind.UNAUTHORIZED.name(),
                e.getUpstreamMessage() != null ? e.getUpstreamMessage() : defaultMessage(unconfirmed));
    }

    private static ResponseEntity<Map<String, Object>> failure(HttpStatus status, String code, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", false);
        body.put("error", status.getReasonPhrase());
        body.put("code", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }

    /**
     * @return the first problem with the sign-up form, or {@code null} when it is acceptable
     */
    static String registrationProblem(RegisterRequest registerRequest) {
        if (registerRequest == null || !isEmail(registerRequest.email)) {
            return "Invalid email address";
        }
        String password = registerRequest.password;
        if (password == null || password.length() < 8) {
            return "Password must be at least 8 characters";
        }
        if (password.chars().noneMatch(c -> c >= 'a' && c <= 'z')) {
            return "Password must contain a lowercase letter";
        }
        if (password.chars().noneMatch(c -> c >= 'A' && c <= 'Z')) {
            return "Password must contain an uppercase letter";
        }
        if (password.chars().noneMatch(c -> c >= '0' && c <= '9')) {
            return "Password must contain a number";
        }
        if (registerRequest.fullName != null && registerRequest.fullName.trim().length() < 2) {
            return "Name must be at least 2 characters";
        }
        return null;
    }

    private static String defaultMessage(boolean unconfirmed) {
        return unconfirmed ? "Please confirm your email address before signing in." : "Invalid email or password";
    }

    private static boolean isEmail(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        int at = trimmed.indexOf('@');
        return at > 0 && at < trimmed.length() - 1 && trimmed.indexOf(' ') < 0;
    }
}
