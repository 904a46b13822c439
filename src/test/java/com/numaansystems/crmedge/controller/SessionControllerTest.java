package com.numaansystems.crmedge.controller;

import com.numaansystems.crmedge.broker.RefreshFailedException;
import com.numaansystems.crmedge.broker.TenantDetails;
import com.numaansystems.crmedge.broker.UpstreamStatusException;
import com.numaansystems.crmedge.gateway.EdgeGatewayFilter;
import com.numaansystems.crmedge.resilience.CircuitOpenException;
import com.numaansystems.crmedge.resilience.DegradedResult;
import com.numaansystems.crmedge.resilience.EdgeException;
import com.numaansystems.crmedge.resilience.ErrorKind;
import com.numaansystems.crmedge.service.SessionLifecycleService;
import com.numaansystems.crmedge.service.TenantDetailsService;
import com.numaansystems.crmedge.session.OnboardingStatus;
import com.numaansystems.crmedge.session.SessionCookieService;
import com.numaansystems.crmedge.session.SessionLookup;
import com.numaansystems.crmedge.session.SessionPayload;
import com.numaansystems.crmedge.session.VerificationFailure;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for SessionController.
 *
 * <p>Tests login and registration validation, upstream rejection handling, token
 * refresh, tenant switching, logout, and the session and tenant endpoints.</p>
 */
@WebMvcTest(controllers = SessionController.class,
        excludeFilters = @ComponentScan.Filter(type = FilterType.ASSIGNABLE_TYPE, classes = EdgeGatewayFilter.class))
@Import(TestSecurityConfig.class)
class SessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SessionLifecycleService sessionLifecycleService;

    @MockBean
    private SessionCookieService sessionCookieService;

    @MockBean
    private TenantDetailsService tenantDetailsService;

    private static SessionPayload payload(String tenantId) {
        return SessionPayload.builder()
                .userId("u1")
                .email("ana@example.com")
                .tenantId(tenantId)
                .role("owner")
                .permissions(List.of("contacts:read"))
                .accessToken("secret-access")
                .refreshToken("secret-refresh")
                .sessionExpiresAt(1_800_000_000L)
                .onboardingStatus(OnboardingStatus.COMPLETED)
                .build();
    }

    @Test
    @DisplayName("Should sign in and return the redirect target")
    void testLoginSuccess() throws Exception {
        // Arrange
        when(sessionLifecycleService.login(eq("ana@example.com"), eq("pw"), any(HttpServletResponse.class)))
                .thenReturn("/app/dashboard");

        // Act & Assert
        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\" ana@example.com \",\"password\":\"pw\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.redirectTo").value("/app/dashboard"));
    }

    @Test
    @DisplayName("Should reject a login without a valid email")
    void testLoginInvalidEmail() throws Exception {
        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"not-an-email\",\"password\":\"pw\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION"))
                .andExpect(jsonPath("$.error").value("Bad Request"));

        verify(sessionLifecycleService, never()).login(anyString(), anyString(), any(HttpServletResponse.class));
    }

    @Test
    @DisplayName("Should reject an unreadable login body")
    void testLoginMalformedBody() throws Exception {
        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION"));
    }

    @Test
    @DisplayName("Should relay an upstream credential rejection as 401")
    void testLoginRejected() throws Exception {
        // Arrange
        when(sessionLifecycleService.login(anyString(), anyString(), any(HttpServletResponse.class)))
                .thenThrow(new UpstreamStatusException(401, "Wrong password", "INVALID_CREDENTIALS"));

        // Act & Assert
        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ana@example.com\",\"password\":\"bad\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"))
                .andExpect(jsonPath("$.message").value("Wrong password"));
    }

    @Test
    @DisplayName("Should explain an unconfirmed email")
    void testLoginEmailNotConfirmed() throws Exception {
        // Arrange
        when(sessionLifecycleService.login(anyString(), anyString(), any(HttpServletResponse.class)))
                .thenThrow(new UpstreamStatusException(403, null, "EMAIL_NOT_CONFIRMED"));

        // Act & Assert
        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ana@example.com\",\"password\":\"pw\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("EMAIL_NOT_CONFIRMED"))
                .andExpect(jsonPath("$.message").value("Please confirm your email address before signing in."));
    }

    @Test
    @DisplayName("Should map an upstream outage to 502")
    void testLoginUpstreamDown() throws Exception {
        // Arrange
        when(sessionLifecycleService.login(anyString(), anyString(), any(HttpServletResponse.class)))
                .thenThrow(new UpstreamStatusException(503, null, null));

        // Act & Assert
        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ana@example.com\",\"password\":\"pw\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("UPSTREAM"));
    }

    @Test
    @DisplayName("Should map an open circuit to 503")
    void testLoginCircuitOpen() throws Exception {
        // Arrange
        when(sessionLifecycleService.login(anyString(), anyString(), any(HttpServletResponse.class)))
                .thenThrow(new CircuitOpenException("upstream-api", "Circuit upstream-api is open"));

        // Act & Assert
        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ana@example.com\",\"password\":\"pw\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("The service is temporarily unavailable. Please try again later."));
    }

    @Test
    @DisplayName("Should log out and point to the login page")
    void testLogout() throws Exception {
        mockMvc.perform(post("/api/auth/logout"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.redirectTo").value("/login"));

        verify(sessionLifecycleService).logout(any(HttpServletRequest.class), any(HttpServletResponse.class));
    }

    @Test
    @DisplayName("Should describe the session without exposing tokens")
    void testSession() throws Exception {
        // Arrange
        when(sessionCookieService.lookup(any(HttpServletRequest.class)))
                .thenReturn(SessionLookup.authenticated(payload("t1")));

        // Act & Assert
        mockMvc.perform(get("/api/auth/session"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value("u1"))
                .andExpect(jsonPath("$.tenantId").value("t1"))
                .andExpect(jsonPath("$.role").value("owner"))
                .andExpect(jsonPath("$.permissions[0]").value("contacts:read"))
                .andExpect(jsonPath("$.expiresAt").value(1_800_000_000L))
                .andExpect(jsonPath("$.onboarding.status").value("completed"))
                .andExpect(jsonPath("$.onboarding.requiresOnboarding").value(false))
                .andExpect(jsonPath("$.accessToken").doesNotExist())
                .andExpect(jsonPath("$.refreshToken").doesNotExist());
    }

    @Test
    @DisplayName("Should answer 401 without a session")
    void testSessionAnonymous() throws Exception {
        // Arrange
        when(sessionCookieService.lookup(any(HttpServletRequest.class))).thenReturn(SessionLookup.anonymous());

        // Act & Assert
        mockMvc.perform(get("/api/auth/session"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    @Test
    @DisplayName("Should report an expired session for a rejected cookie")
    void testSessionExpired() throws Exception {
        // Arrange
        when(sessionCookieService.lookup(any(HttpServletRequest.class)))
                .thenReturn(SessionLookup.invalidCookie(VerificationFailure.EXPIRED));

        // Act & Assert
        mockMvc.perform(get("/api/auth/session"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("SESSION_EXPIRED"))
                .andExpect(jsonPath("$.message").value("Your session has expired. Please sign in again."));
    }

    @Test
    @DisplayName("Should return no tenant for a session without one")
    void testTenantMissing() throws Exception {
        // Arrange
        when(sessionCookieService.lookup(any(HttpServletRequest.class)))
                .thenReturn(SessionLookup.authenticated(payload("")));

        // Act & Assert
        mockMvc.perform(get("/api/auth/tenant"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tenant").isEmpty())
                .andExpect(jsonPath("$.stale").value(false));

        verify(tenantDetailsService, never()).currentTenant(any(SessionPayload.class));
    }

    @Test
    @DisplayName("Should flag stale tenant details")
    void testTenantStale() throws Exception {
        // Arrange
        SessionPayload session = payload("t1");
        TenantDetails tenant = new TenantDetails();
        tenant.id = "t1";
        tenant.name = "Acme";
        tenant.plan = "pro";
        when(sessionCookieService.lookup(any(HttpServletRequest.class))).thenReturn(SessionLookup.authenticated(session));
        when(tenantDetailsService.currentTenant(session))
                .thenReturn(DegradedResult.stale(tenant, new IOException("upstream down")));

        // Act & Assert
        mockMvc.perform(get("/api/auth/tenant"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tenant.name").value("Acme"))
                .andExpect(jsonPath("$.tenant.plan").value("pro"))
                .andExpect(jsonPath("$.tenant.slug").doesNotExist())
                .andExpect(jsonPath("$.stale").value(true));
    }

    @Test
    @DisplayName("Should register an account and report the pending confirmation")
    void testRegisterSuccess() throws Exception {
        // Arrange
        when(sessionLifecycleService.register("ana@example.com", "Secret123", "Ana Lopez")).thenReturn(true);

        // Act & Assert
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ana@example.com\",\"password\":\"Secret123\",\"fullName\":\" Ana Lopez \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.confirmationRequired").value(true));
    }

    @Test
    @DisplayName("Should reject a weak password before calling upstream")
    void testRegisterWeakPassword() throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ana@example.com\",\"password\":\"secret123\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("VALIDATION"))
                .andExpect(jsonPath("$.message").value("Password must contain an uppercase letter"));

        verify(sessionLifecycleService, never()).register(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("Should relay an upstream registration conflict")
    void testRegisterConflict() throws Exception {
        // Arrange
        when(sessionLifecycleService.register(anyString(), anyString(), any()))
                .thenThrow(new UpstreamStatusException(409, "Email already registered", "EMAIL_TAKEN"));

        // Act & Assert
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ana@example.com\",\"password\":\"Secret123\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("EMAIL_TAKEN"))
                .andExpect(jsonPath("$.message").value("Email already registered"));
    }

    @Test
    @DisplayName("Should refresh the session tokens on request")
    void testRefresh() throws Exception {
        // Arrange
        SessionPayload rotated = payload("t1").withRotatedTokens("a2", "r2", 1_700_000_900L);
        when(sessionLifecycleService.refresh(any(HttpServletRequest.class), any(HttpServletResponse.class)))
                .thenReturn(rotated);

        // Act & Assert
        mockMvc.perform(post("/api/auth/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.accessTokenExpiresAt").value(1_700_000_900L))
                .andExpect(jsonPath("$.accessToken").doesNotExist());
    }

    @Test
    @DisplayName("Should answer 401 when the refresh is rejected")
    void testRefreshRejected() throws Exception {
        // Arrange
        when(sessionLifecycleService.refresh(any(HttpServletRequest.class), any(HttpServletResponse.class)))
                .thenThrow(new RefreshFailedException("Token refresh failed", null));

        // Act & Assert
        mockMvc.perform(post("/api/auth/refresh"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("SESSION_EXPIRED"));
    }

    @Test
    @DisplayName("Should switch tenant and return the new landing page")
    void testSwitchTenant() throws Exception {
        // Arrange
        SessionPayload switched = payload("t2").toBuilder().role("admin").build();
        when(sessionLifecycleService.switchTenant(eq("t2"), any(HttpServletRequest.class), any(HttpServletResponse.class)))
                .thenReturn(switched);
        when(sessionLifecycleService.destinationFor(switched)).thenReturn("/app/dashboard");

        // Act & Assert
        mockMvc.perform(post("/api/auth/switch-tenant")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tenantId\":\"t2\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.tenantId").value("t2"))
                .andExpect(jsonPath("$.role").value("admin"))
                .andExpect(jsonPath("$.redirectTo").value("/app/dashboard"));
    }

    @Test
    @DisplayName("Should answer 403 when the tenant switch is refused")
    void testSwitchTenantRefused() throws Exception {
        // Arrange
        when(sessionLifecycleService.switchTenant(eq("t9"), any(HttpServletRequest.class), any(HttpServletResponse.class)))
                .thenThrow(new EdgeException(ErrorKind.FORBIDDEN, "Tenant switch refused by upstream"));

        // Act & Assert
        mockMvc.perform(post("/api/auth/switch-tenant")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tenantId\":\"t9\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    @DisplayName("Should render an unexpected failure as a generic 500 body")
    void testUnexpectedFailure() throws Exception {
        // Arrange
        when(sessionLifecycleService.login(anyString(), anyString(), any(HttpServletResponse.class)))
                .thenThrow(new IllegalStateException("connection pool exhausted"));

        // Act & Assert
        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ana@example.com\",\"password\":\"pw\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Internal Server Error"))
                .andExpect(jsonPath("$.code").value("UNKNOWN"))
                .andExpect(jsonPath("$.message").value(ErrorKind.UNKNOWN.getUserMessage()))
                .andExpect(content().string(org.hamcrest.Matchers.not(
                        org.hamcrest.Matchers.containsString("connection pool exhausted"))));
    }

    @Test
    @DisplayName("Should keep the status of framework errors such as an unsupported method")
    void testMethodNotAllowed() throws Exception {
        mockMvc.perform(get("/api/auth/logout"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error").value("Method Not Allowed"));
    }
}
