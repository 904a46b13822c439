package com.numaansystems.crmedge.session;

import com.numaansystems.crmedge.config.EdgeProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Reads, writes and clears the signed session cookie.
 *
 * <h2>Cookie attributes</h2>
 * <ul>
 *   <li>HttpOnly, SameSite=Lax, Path=/</li>
 *   <li>Secure unless {@code crm.edge.session.secure-cookie=false} (local development over http)</li>
 *   <li>Max-Age equal to the configured session duration; 0 when cleared</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class SessionCookieService {

    private static final Logger logger = LoggerFactory.getLogger(SessionCookieService.class);

    static final String LOOKUP_ATTRIBUTE = SessionCookieService.class.getName() + ".LOOKUP";

    private final SessionCodec sessionCodec;
    private final EdgeProperties.Session settings;
    private final Clock clock;

    public SessionCookieService(SessionCodec sessionCodec, EdgeProperties properties, Clock clock) {
        this.sessionCodec = sessionCodec;
        this.settings = properties.getSession();
        this.clock = clock;
    }

    /**
     * Verifies the session cookie of {@code request}, if any. The outcome is kept as a
     * request attribute so the cookie is verified once per request.
     */
    public SessionLookup lookup(HttpServletRequest request) {
        if (request.getAttribute(LOOKUP_ATTRIBUTE) instanceof SessionLookup cached) {
            return cached;
        }
        SessionLookup lookup = verifyCookie(request);
        request.setAttribute(LOOKUP_ATTRIBUTE, lookup);
        return lookup;
    }

    private SessionLookup verifyCookie(HttpServletRequest request) {
        String token = readCookie(request);
        if (token == null) {
            return SessionLookup.anonymous();
        }
        VerificationResult result = sessionCodec.verify(token);
        if (!result.isValid()) {
            logger.debug("Session cookie rejected: {}", result.getFailure());
            return SessionLookup.invalidCookie(result.getFailure());
        }
        return SessionLookup.authenticated(result.getPayload());
    }

    /**
     * Starts a new session: stamps creation and expiry times, signs and sets the cookie.
     *
     * @return the payload that was signed
     */
    public SessionPayload start(HttpServletResponse response, SessionPayload.Builder builder) {
        long now = clock.instant().getEpochSecond();
        SessionPayload payload = builder
                .createdAt(now)
                .sessionExpiresAt(now + settings.getDuration().getSeconds())
                .build();
        issue(response, payload);
        logger.info("Session issued for user {} (tenant {})", payload.getUserId(),
                payload.hasTenant() ? payload.getTenantId() : "none");
        return payload;
    }

    /**
     * Signs {@code payload} and sets it as the session cookie. Used for new sessions and
     * for rewriting the cookie after token rotation.
     */
    public void issue(HttpServletResponse response, SessionPayload payload) {
        String token = sessionCodec.sign(payload, settings.getDuration());
        writeCookie(response, token, settings.getDuration());
    }

    public void clear(HttpServletResponse response) {
        writeCookie(response, "", Duration.ZERO);
    }

    public String getCookieName() {
        return settings.getCookieName();
    }

    private String readCookie(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (settings.getCookieName().equals(cookie.getName())) {
                return cookie.getValue();
            }
        }
        return null;
    }

    private void writeCookie(HttpServletResponse response, String value, Duration maxAge) {
        ResponseCookie cookie = ResponseCookie.from(settings.getCookieName(), value)
                .httpOnly(true)
                .secure(settings.isSecureCookie())
                .sameSite("Lax")
                .path("/")
                .maxAge(maxAge)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}
