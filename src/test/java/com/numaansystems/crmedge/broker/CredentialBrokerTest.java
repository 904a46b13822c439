package com.numaansystems.crmedge.broker;

import com.numaansystems.crmedge.config.EdgeProperties;
import com.numaansystems.crmedge.resilience.CircuitOpenException;
import com.numaansystems.crmedge.resilience.ErrorKind;
import com.numaansystems.crmedge.resilience.MutableClock;
import com.numaansystems.crmedge.session.OnboardingStatus;
import com.numaansystems.crmedge.session.SessionPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CredentialBroker.
 */
@ExtendWith(MockitoExtension.class)
class CredentialBrokerTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_772_000_000L);

    @Mock
    private UpstreamAuthClient upstreamAuthClient;

    private CredentialBroker broker;

    @BeforeEach
    void setUp() {
        broker = new CredentialBroker(upstreamAuthClient, new EdgeProperties(), new MutableClock(NOW));
    }

    private static SessionPayload sessionExpiringIn(long seconds, String refreshToken) {
        return SessionPayload.builder()
                .userId("u1")
                .tenantId("t1")
                .role("admin")
                .onboardingStatus(OnboardingStatus.COMPLETED)
                .accessToken("old-access")
                .refreshToken(refreshToken)
                .accessTokenExpiresAt(NOW.getEpochSecond() + seconds)
                .sessionExpiresAt(NOW.getEpochSecond() + 86_400)
                .createdAt(NOW.getEpochSecond() - 3600)
                .build();
    }

    private static TokenRefreshResponse tokens(String access, String refresh, Long expiresIn) {
        TokenRefreshResponse response = new TokenRefreshResponse();
        response.accessToken = access;
        response.refreshToken = refresh;
        response.expiresIn = expiresIn;
        return response;
    }

    @Test
    @DisplayName("Should leave a fresh session untouched")
    void testFreshSession() {
        // Arrange
        SessionPayload payload = sessionExpiringIn(3600, "r1");

        // Act
        BrokeredSession result = broker.ensureFreshCredentials(payload);

        // Assert
        assertFalse(result.isRotated());
        assertSame(payload, result.getPayload());
        verify(upstreamAuthClient, never()).refresh(anyString());
    }

    @Test
    @DisplayName("Should rotate tokens and keep identity when the access token is about to expire")
    void testRotatesStaleToken() {
        // Arrange
        SessionPayload payload = sessionExpiringIn(60, "r1");
        when(upstreamAuthClient.refresh("r1")).thenReturn(tokens("new-access", "r2", 900L));

        // Act
        BrokeredSession result = broker.ensureFreshCredentials(payload);

        // Assert
        assertTrue(result.isRotated());
        SessionPayload rotated = result.getPayload();
        assertEquals("new-access", rotated.getAccessToken());
        assertEquals("r2", rotated.getRefreshToken());
        assertEquals(NOW.getEpochSecond() + 900, rotated.getAccessTokenExpiresAt());
        assertEquals(payload.getUserId(), rotated.getUserId());
        assertEquals(payload.getTenantId(), rotated.getTenantId());
        assertEquals(payload.getRole(), rotated.getRole());
        assertEquals(payload.getSessionExpiresAt(), rotated.getSessionExpiresAt());
        assertEquals(payload.getOnboardingStatus(), rotated.getOnboardingStatus());
    }

    @Test
    @DisplayName("Should keep the old refresh token when the upstream does not rotate it")
    void testKeepsRefreshToken() {
        // Arrange
        when(upstreamAuthClient.refresh("r1")).thenReturn(tokens("new-access", null, null));

        // Act
        SessionPayload rotated = broker.ensureFreshCredentials(sessionExpiringIn(10, "r1")).getPayload();

        // Assert
        assertEquals("r1", rotated.getRefreshToken());
        assertEquals(NOW.getEpochSecond() + CredentialBroker.DEFAULT_EXPIRES_IN_SECONDS,
                rotated.getAccessTokenExpiresAt());
    }

    @Test
    @DisplayName("Should fail without calling upstream when the session has no refresh token")
    void testNoRefreshToken() {
        // Act
        RefreshFailedException error = assertThrows(RefreshFailedException.class,
                () -> broker.ensureFreshCredentials(sessionExpiringIn(10, "")));

        // Assert
        assertEquals(ErrorKind.SESSION_EXPIRED, error.getKind());
        verify(upstreamAuthClient, never()).refresh(anyString());
    }

    @Test
    @DisplayName("Should surface an upstream rejection as a refresh failure")
    void testUpstreamRejects() {
        // Arrange
        when(upstreamAuthClient.refresh("r1")).thenThrow(new UpstreamStatusException(401, "revoked", "TOKEN_REVOKED"));

        // Act
        RefreshFailedException error = assertThrows(RefreshFailedException.class,
                () -> broker.ensureFreshCredentials(sessionExpiringIn(10, "r1")));

        // Assert
        assertInstanceOf(UpstreamStatusException.class, error.getCause());
        assertFalse(error.isRetryable());
    }

    @Test
    @DisplayName("Should surface an open circuit as a refresh failure")
    void testCircuitOpen() {
        // Arrange
        when(upstreamAuthClient.refresh("r1")).thenThrow(new CircuitOpenException("upstream-api", "Circuit upstream-api is open"));

        // Act & Assert
        assertThrows(RefreshFailedException.class, () -> broker.ensureFreshCredentials(sessionExpiringIn(10, "r1")));
    }

    @Test
    @DisplayName("Should reject a refresh answer without an access token")
    void testEmptyAnswer() {
        // Arrange
        when(upstreamAuthClient.refresh("r1")).thenReturn(tokens("", "r2", 900L));

        // Act & Assert
        assertThrows(RefreshFailedException.class, () -> broker.ensureFreshCredentials(sessionExpiringIn(10, "r1")));
    }

    @Test
    @DisplayName("New expiry prefers expiresAt, then the token claim, then expiresIn")
    void testNewExpiry() {
        // Arrange
        long now = NOW.getEpochSecond();
        TokenRefreshResponse explicit = tokens("opaque", null, 60L);
        explicit.expiresAt = now + 123;
        TokenRefreshResponse fromClaim = tokens(AccessTokenInspectorTest.tokenExpiringAt(now + 456), null, 60L);
        TokenRefreshResponse fromExpiresIn = tokens("opaque", null, 60L);

        // Act & Assert
        assertEquals(now + 123, CredentialBroker.newExpiry(explicit, now));
        assertEquals(now + 456, CredentialBroker.newExpiry(fromClaim, now));
        assertEquals(now + 60, CredentialBroker.newExpiry(fromExpiresIn, now));
    }
}
