package com.numaansystems.crmedge.gateway;

import com.numaansystems.crmedge.routing.RouteClass;
import com.numaansystems.crmedge.routing.RouteClassifier;
import com.numaansystems.crmedge.session.SessionCookieService;
import com.numaansystems.crmedge.session.SessionLookup;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Servlet filter that runs the {@link EdgeGateway} on every request.
 *
 * <p>For each request the filter:</p>
 * <ol>
 *   <li>lets static assets through untouched,</li>
 *   <li>reads and verifies the session cookie (failures never throw),</li>
 *   <li>asks the gateway for a decision and either redirects or continues the chain,</li>
 *   <li>on continue, wraps the request so downstream code sees only verified identity headers.</li>
 * </ol>
 *
 * <p>Request parameters are never read through {@link HttpServletRequest#getParameter(String)}:
 * that would make the container consume form and multipart bodies before the proxy
 * streams them upstream. The {@code redirect} parameter is taken from the raw query
 * string, and only on guest-only routes.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class EdgeGatewayFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(EdgeGatewayFilter.class);

    static final String REDIRECT_PARAM = "redirect";

    private final EdgeGateway edgeGateway;
    private final SessionCookieService sessionCookieService;

    public EdgeGatewayFilter(EdgeGateway edgeGateway, SessionCookieService sessionCookieService) {
        this.edgeGateway = edgeGateway;
        this.sessionCookieService = sessionCookieService;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return RouteClassifier.isStaticAsset(pathOf(request));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String path = pathOf(request);
        SessionLookup session = sessionCookieService.lookup(request);
        String redirectParam = RouteClassifier.classify(path) == RouteClass.GUEST_ONLY
                ? queryParameter(request, REDIRECT_PARAM)
                : null;
        GatewayDecision decision = edgeGateway.decide(path, redirectParam, session);
        log.debug("{} {} -> {}", request.getMethod(), path, decision);

        if (decision.isClearCookie()) {
            sessionCookieService.clear(response);
        }

        if (decision.isRedirect()) {
            response.sendRedirect(request.getContextPath() + decision.getLocation());
            return;
        }

        if (decision.getCacheControl() != null) {
            response.setHeader(HttpHeaders.CACHE_CONTROL, decision.getCacheControl());
        }

        chain.doFilter(new IdentityHeadersRequestWrapper(request, session.getPayload()), response);
    }

    /**
     * First value of {@code name} in the query string, percent-decoded; the body is never touched.
     */
    static String queryParameter(HttpServletRequest request, String name) {
        String query = request.getQueryString();
        if (query == null || query.isEmpty()) {
            return null;
        }
        String raw = UriComponentsBuilder.newInstance()
                .query(query)
                .build()
                .getQueryParams()
                .getFirst(name);
        return raw != null ? UriUtils.decode(raw, StandardCharsets.UTF_8) : null;
    }

    private static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            uri = uri.substring(contextPath.length());
        }
        return uri.isEmpty() ? "/" : uri;
    }
}
