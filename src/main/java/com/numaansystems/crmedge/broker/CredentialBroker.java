package com.numaansystems.crmedge.broker;

import com.numaansystems.crmedge.config.EdgeProperties;
import com.numaansystems.crmedge.session.SessionPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Keeps the upstream access token of a session fresh enough to forward.
 *
 * <p>A token expiring within the refresh buffer (or whose expiry is unknown) is renewed
 * with the session's refresh token before the request goes upstream. The rotated
 * session keeps its identity, onboarding claims and session expiry; only the token
 * fields change.</p>
 *
 * <p>Concurrent requests of one user may each trigger a refresh; they are not merged.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class CredentialBroker {

    private static final Logger logger = LoggerFactory.getLogger(CredentialBroker.class);

    static final long DEFAULT_EXPIRES_IN_SECONDS = 900;

    private final UpstreamAuthClient upstreamAuthClient;
    private final Duration refreshBuffer;
    private final Clock clock;

    public CredentialBroker(UpstreamAuthClient upstreamAuthClient, EdgeProperties properties, Clock clock) {
        this.upstreamAuthClient = upstreamAuthClient;
        this.refreshBuffer = properties.getBroker().getRefreshBuffer();
        this.clock = clock;
    }

    /**
     * Returns the session unchanged when its access token is fresh, otherwise a copy
     * with rotated tokens.
     *
     * @throws RefreshFailedException when a needed refresh is impossible or fails
     */
    public BrokeredSession ensureFreshCredentials(SessionPayload payload) {
        long now = clock.instant().getEpochSecond();
        if (!AccessTokenInspector.needsRefresh(payload, now, refreshBuffer)) {
            return BrokeredSession.unchanged(payload);
        }

        return BrokeredSession.rotated(rotate(payload, now));
    }

    /**
     * Renews the access token whatever its remaining lifetime.
     *
     * @return the session with rotated tokens
     * @throws RefreshFailedException when the session has no refresh token or the refresh fails
     */
    public SessionPayload refreshNow(SessionPayload payload) {
        return rotate(payload, clock.instant().getEpochSecond());
    }

    private SessionPayload rotate(SessionPayload payload, long now) {
        if (payload.getRefreshToken().isEmpty()) {
            logger.warn("Access token of user {} needs a refresh and the session has no refresh token", payload.getUserId());
            throw new RefreshFailedException("No refresh token in session", null);
        }

        TokenRefreshResponse tokens;
        try {
            tokens = upstreamAuthClient.refresh(payload.getRefreshToken());
        } catch (RuntimeException e) {
            logger.warn("Token refresh failed for user {}: {}", payload.getUserId(), e.getMessage());
            throw new RefreshFailedException("Token refresh failed", e);
        }

        if (tokens == null || tokens.accessToken == null || tokens.accessToken.isEmpty()) {
            logger.warn("Token refresh for user {} returned no access token", payload.getUserId());
            throw new RefreshFailedException("Token refresh returned no access token", null);
        }

        String refreshToken = tokens.refreshToken != null && !tokens.refreshToken.isEmpty()
                ? tokens.refreshToken
                : payload.getRefreshToken();
        long expiresAt = newExpiry(tokens, now);

        logger.info("Access token refreshed for user {}", payload.getUserId());
        return payload.withRotatedTokens(tokens.accessToken, refreshToken, expiresAt);
    }

    /**
     * Explicit {@code expiresAt}, else the new token's {@code exp}, else {@code now + expiresIn}.
     */
    static long newExpiry(TokenRefreshResponse tokens, long now) {
        if (tokens.expiresAt != null && tokens.expiresAt > 0) {
            return tokens.expiresAt;
        }
        Optional<Long> fromToken = AccessTokenInspector.unverifiedExpiry(tokens.accessToken);
        if (fromToken.isPresent()) {
            return fromToken.get();
        }
        long expiresIn = tokens.expiresIn != null && tokens.expiresIn > 0 ? tokens.expiresIn : DEFAULT_EXPIRES_IN_SECONDS;
        return now + expiresIn;
    }
}
