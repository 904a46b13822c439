package com.numaansystems.crmedge.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.crmedge.session.SessionPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;

/**
 * Freshness checks on the upstream access token.
 *
 * <p>The {@code exp} claim is read without verifying the signature. It only decides
 * when to refresh early; the upstream API remains the authority on token validity.</p>
 */
public final class AccessTokenInspector {

    private static final Logger logger = LoggerFactory.getLogger(AccessTokenInspector.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AccessTokenInspector() {
    }

    /**
     * Reads the unverified {@code exp} claim (epoch seconds) of a compact JWT.
     */
    public static Optional<Long> unverifiedExpiry(String jwt) {
        if (jwt == null || jwt.isEmpty()) {
            return Optional.empty();
        }
        String[] parts = jwt.split("\\.");
        if (parts.length < 2) {
            return Optional.empty();
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(parts[1]);
            JsonNode exp = MAPPER.readTree(json).get("exp");
            if (exp != null && exp.isNumber()) {
                return Optional.of(exp.asLong());
            }
        } catch (IllegalArgumentException | IOException e) {
            logger.debug("Access token payload is not decodable: {}", e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Expiry of the session's access token: the stored value, else the token's own claim.
     */
    public static Optional<Long> expiryOf(SessionPayload payload) {
        Long stored = payload.getAccessTokenExpiresAt();
        if (stored != null && stored > 0) {
            return Optional.of(stored);
        }
        return unverifiedExpiry(payload.getAccessToken());
    }

    /**
     * A token is stale when it expires within {@code buffer}, or when its expiry
     * cannot be determined.
     */
    public static boolean needsRefresh(SessionPayload payload, long nowEpochSeconds, Duration buffer) {
        Optional<Long> expiry = expiryOf(payload);
        if (expiry.isEmpty()) {
            return true;
        }
        return expiry.get() - nowEpochSeconds < buffer.getSeconds();
    }
}
