package com.numaansystems.crmedge.session;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.SecurityException;
import io.jsonwebtoken.security.SignatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Signs and verifies the session token carried in the session cookie.
 *
 * <p>Tokens are compact HS256 JWTs. Verification never throws: every failure is
 * reported as a {@link VerificationResult} with a {@link VerificationFailure} reason.</p>
 *
 * <h2>Rejected tokens</h2>
 * <ul>
 *   <li>malformed or empty tokens</li>
 *   <li>signature mismatch (signed with another secret)</li>
 *   <li>any algorithm other than HS256, including unsigned tokens</li>
 *   <li>expired {@code exp} claim</li>
 *   <li>payload {@code expiresAt} in the past, even when {@code exp} is still valid</li>
 *   <li>missing {@code userId}</li>
 * </ul>
 *
 * <p>The secret is supplied by the caller; this class never reads configuration
 * or the environment. Instances are immutable and thread-safe.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class SessionCodec {

    private static final Logger logger = LoggerFactory.getLogger(SessionCodec.class);

    static final String ALGORITHM = "HS256";
    private static final String JCA_ALGORITHM = "HmacSHA256";
    private static final int MIN_SECRET_BYTES = 32;

    static final String CLAIM_USER_ID = "userId";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_TENANT_ID = "tenantId";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_PERMISSIONS = "permissions";
    static final String CLAIM_ACCESS_TOKEN = "accessToken";
    static final String CLAIM_REFRESH_TOKEN = "refreshToken";
    static final String CLAIM_ACCESS_TOKEN_EXPIRES_AT = "accessTokenExpiresAt";
    static final String CLAIM_EXPIRES_AT = "expiresAt";
    static final String CLAIM_CREATED_AT = "createdAt";
    static final String CLAIM_ONBOARDING_STATUS = "onboardingStatus";
    static final String CLAIM_ONBOARDING_STEP = "onboardingStep";
    static final String CLAIM_REQUIRES_ONBOARDING = "requiresOnboarding";

    private final SecretKey key;
    private final Clock clock;
    private final JwtParser parser;

    public SessionCodec(String secret) {
        this(secret, Clock.systemUTC());
    }

    /**
     * @param secret HMAC secret, at least 32 bytes in UTF-8
     * @param clock time source for {@code iat}/{@code exp} and expiry checks
     */
    public SessionCodec(String secret, Clock clock) {
        if (secret == null) {
            throw new IllegalArgumentException("Session secret is required");
        }
        byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                    "Session secret must be at least " + MIN_SECRET_BYTES + " bytes, got " + secretBytes.length);
        }
        this.key = new SecretKeySpec(secretBytes, JCA_ALGORITHM);
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Signs {@code payload} into a compact token valid for {@code ttl}.
     *
     * @param payload session content
     * @param ttl lifetime of the token's own {@code exp} claim
     * @return the compact JWT
     */
    public String sign(SessionPayload payload, Duration ttl) {
        Instant now = clock.instant();
        return Jwts.builder()
                .claims(toClaims(payload))
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Verifies {@code token} and decodes its payload.
     *
     * @param token compact JWT, possibly {@code null}
     * @return the payload, or the reason the token was rejected
     */
    public VerificationResult verify(String token) {
        if (token == null || token.isBlank()) {
            return VerificationResult.invalid(VerificationFailure.MISSING);
        }

        Jws<Claims> jws;
        try {
            jws = parser.parseSignedClaims(token);
        } catch (ExpiredJwtException e) {
            return VerificationResult.invalid(VerificationFailure.EXPIRED);
        } catch (SignatureException e) {
            logger.warn("Session token signature mismatch");
            return VerificationResult.invalid(VerificationFailure.BAD_SIGNATURE);
        } catch (UnsupportedJwtException | SecurityException e) {
            logger.warn("Session token rejected: {}", e.getMessage());
            return VerificationResult.invalid(VerificationFailure.UNSUPPORTED_ALGORITHM);
        } catch (MalformedJwtException | IllegalArgumentException e) {
            logger.debug("Malformed session token: {}", e.getMessage());
            return VerificationResult.invalid(VerificationFailure.MALFORMED);
        } catch (JwtException e) {
            logger.warn("Session token verification failed: {}", e.getMessage());
            return VerificationResult.invalid(VerificationFailure.MALFORMED);
        }

        if (!ALGORITHM.equals(jws.getHeader().getAlgorithm())) {
            logger.warn("Session token signed with unexpected algorithm {}", jws.getHeader().getAlgorithm());
            return VerificationResult.invalid(VerificationFailure.UNSUPPORTED_ALGORITHM);
        }

        Claims claims = jws.getPayload();
        String userId = stringClaim(claims, CLAIM_USER_ID);
        if (userId == null || userId.isEmpty()) {
            logger.warn("Session token without userId");
            return VerificationResult.invalid(VerificationFailure.MISSING_USER_ID);
        }

        SessionPayload payload = fromClaims(userId, claims);
        long now = clock.instant().getEpochSecond();
        if (payload.getSessionExpiresAt() > 0 && payload.getSessionExpiresAt() < now) {
            logger.debug("Session for user {} expired at {}", userId, payload.getSessionExpiresAt());
            return VerificationResult.invalid(VerificationFailure.SESSION_EXPIRED);
        }
        return VerificationResult.valid(payload);
    }

    private static Map<String, Object> toClaims(SessionPayload payload) {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put(CLAIM_USER_ID, payload.getUserId());
        claims.put(CLAIM_EMAIL, payload.getEmail());
        claims.put(CLAIM_TENANT_ID, payload.getTenantId());
        claims.put(CLAIM_ROLE, payload.getRole());
        if (payload.getPermissions() != null) {
            claims.put(CLAIM_PERMISSIONS, payload.getPermissions());
        }
        claims.put(CLAIM_ACCESS_TOKEN, payload.getAccessToken());
        claims.put(CLAIM_REFRESH_TOKEN, payload.getRefreshToken());
        if (payload.getAccessTokenExpiresAt() != null) {
            claims.put(CLAIM_ACCESS_TOKEN_EXPIRES_AT, payload.getAccessTokenExpiresAt());
        }
        claims.put(CLAIM_EXPIRES_AT, payload.getSessionExpiresAt());
        claims.put(CLAIM_CREATED_AT, payload.getCreatedAt());
        if (payload.getOnboardingStatus() != null) {
            claims.put(CLAIM_ONBOARDING_STATUS, payload.getOnboardingStatus().getValue());
        }
        if (payload.getOnboardingStep() != null) {
            claims.put(CLAIM_ONBOARDING_STEP, payload.getOnboardingStep());
        }
        if (payload.getRequiresOnboarding() != null) {
            claims.put(CLAIM_REQUIRES_ONBOARDING, payload.getRequiresOnboarding());
        }
        return claims;
    }

    private static SessionPayload fromClaims(String userId, Claims claims) {
        Long sessionExpiresAt = longClaim(claims, CLAIM_EXPIRES_AT);
        Long createdAt = longClaim(claims, CLAIM_CREATED_AT);
        Object requiresOnboarding = claims.get(CLAIM_REQUIRES_ONBOARDING);

        return SessionPayload.builder()
                .userId(userId)
                .email(stringClaim(claims, CLAIM_EMAIL))
                .tenantId(stringClaim(claims, CLAIM_TENANT_ID))
                .role(stringClaim(claims, CLAIM_ROLE))
                .permissions(listClaim(claims, CLAIM_PERMISSIONS))
                .accessToken(stringClaim(claims, CLAIM_ACCESS_TOKEN))
                .refreshToken(stringClaim(claims, CLAIM_REFRESH_TOKEN))
                .accessTokenExpiresAt(longClaim(claims, CLAIM_ACCESS_TOKEN_EXPIRES_AT))
                .sessionExpiresAt(sessionExpiresAt != null ? sessionExpiresAt : 0L)
                .createdAt(createdAt != null ? createdAt : 0L)
                .onboardingStatus(OnboardingStatus.fromValue(stringClaim(claims, CLAIM_ONBOARDING_STATUS)).orElse(null))
                .onboardingStep(stringClaim(claims, CLAIM_ONBOARDING_STEP))
                .requiresOnboarding(requiresOnboarding instanceof Boolean flag ? flag : null)
                .build();
    }

    private static String stringClaim(Claims claims, String name) {
        Object value = claims.get(name);
        return value instanceof String text ? text : null;
    }

    private static Long longClaim(Claims claims, String name) {
        Object value = claims.get(name);
        return value instanceof Number number ? number.longValue() : null;
    }

    private static List<String> listClaim(Claims claims, String name) {
        Object value = claims.get(name);
        if (!(value instanceof List<?> items)) {
            return null;
        }
        List<String> result = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }
}
