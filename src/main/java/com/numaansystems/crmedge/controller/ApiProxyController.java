package com.numaansystems.crmedge.controller;

import com.numaansystems.crmedge.broker.BrokeredSession;
import com.numaansystems.crmedge.broker.CredentialBroker;
import com.numaansystems.crmedge.broker.ProxyResponseRelay;
import com.numaansystems.crmedge.broker.UpstreamAuthClient;
import com.numaansystems.crmedge.config.EdgeProperties;
import com.numaansystems.crmedge.gateway.IdentityHeadersRequestWrapper;
import com.numaansystems.crmedge.resilience.EdgeException;
import com.numaansystems.crmedge.resilience.ErrorKind;
import com.numaansystems.crmedge.session.SessionCookieService;
import com.numaansystems.crmedge.session.SessionLookup;
import com.numaansystems.crmedge.session.SessionPayload;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.hc.client5.http.classic.methods.HttpDelete;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpHead;
import org.apache.hc.client5.http.classic.methods.HttpOptions;
import org.apache.hc.client5.http.classic.methods.HttpPatch;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpPut;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.InputStreamEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.net.URI;
import java.util.Enumeration;
import java.util.Locale;
import java.util.Set;

/**
 * Backend-for-frontend proxy to the upstream CRM API.
 *
 * <p>Requests to {@code /api/proxy/**} are forwarded to {@code {upstream}/api/v1/**}
 * on behalf of the session owner. The browser never sees the upstream tokens.</p>
 *
 * <h2>Per request</h2>
 * <ol>
 *   <li>No valid session: 401, nothing is forwarded.</li>
 *   <li>Access token close to expiry: refreshed first and the session cookie rewritten;
 *       a failed refresh is a 401.</li>
 *   <li>Method, query and body are forwarded as-is (bodies streamed) with
 *       {@code Authorization: Bearer}, {@code x-tenant-id} and {@code x-user-id}.
 *       Client credentials, cookies and hop-by-hop headers are dropped.</li>
 *   <li>The response is relayed by {@link ProxyResponseRelay}.</li>
 * </ol>
 *
 * <p>An unreachable or timed-out upstream is a 502. Every other upstream status is
 * relayed verbatim.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestController
@RequestMapping(ApiProxyController.PROXY_PREFIX)
public class ApiProxyController {

    private static final Logger logger = LoggerFactory.getLogger(ApiProxyController.class);

    static final String PROXY_PREFIX = "/api/proxy";

    private static final Set<String> DROPPED_REQUEST_HEADERS = Set.of(
            "authorization",
            "cookie",
            "content-length",
            "host",
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "te",
            "trailer",
            "trailers",
            "transfer-encoding",
            "upgrade"
    );

    private final SessionCookieService sessionCookieService;
    private final CredentialBroker credentialBroker;
    private final ProxyResponseRelay responseRelay;
    private final CloseableHttpClient httpClient;
    private final String upstreamApiUrl;

    public ApiProxyController(SessionCookieService sessionCookieService,
                              CredentialBroker credentialBroker,
                              ProxyResponseRelay responseRelay,
                              CloseableHttpClient httpClient,
                              EdgeProperties properties) {
        this.sessionCookieService = sessionCookieService;
        this.credentialBroker = credentialBroker;
        this.responseRelay = responseRelay;
        this.httpClient = httpClient;
        this.upstreamApiUrl = properties.getUpstream().normalizedBaseUrl() + UpstreamAuthClient.API_PREFIX;
    }

    /**
     * Proxy any request under {@code /api/proxy} to the upstream API.
     *
     * @param request the incoming HTTP request
     * @param response the HTTP response to write to
     */
    @RequestMapping("/**")
    public void proxyRequest(HttpServletRequest request, HttpServletResponse response) throws IOException {
        SessionLookup session = sessionCookieService.lookup(request);
        if (!session.isAuthenticated()) {
            throw new EdgeException(ErrorKind.SESSION_EXPIRED, "No valid session for proxied request");
        }

        BrokeredSession brokered = credentialBroker.ensureFreshCredentials(session.getPayload());
        if (brokered.isRotated()) {
            sessionCookieService.issue(response, brokered.getPayload());
        }
        SessionPayload payload = brokered.getPayload();

        String targetUrl = targetUrl(request);
        logger.debug("Proxying {} {} to {} for user {}",
                request.getMethod(), request.getRequestURI(), targetUrl, payload.getUserId());

        HttpUriRequestBase proxyRequest = createProxyRequest(request.getMethod(), targetUrl);
        copyRequestHeaders(request, proxyRequest);
        proxyRequest.setHeader("Authorization", "Bearer " + payload.getAccessToken());
        proxyRequest.setHeader(IdentityHeadersRequestWrapper.USER_ID, payload.getUserId());
        if (payload.hasTenant()) {
            proxyRequest.setHeader(IdentityHeadersRequestWrapper.TENANT_ID, payload.getTenantId());
        }

        if (hasRequestBody(request)) {
            ContentType contentType = request.getContentType() != null
                    ? ContentType.parseLenient(request.getContentType())
                    : null;
            proxyRequest.setEntity(new InputStreamEntity(request.getInputStream(), request.getContentLengthLong(), contentType));
        }

        try {
            httpClient.execute(proxyRequest, upstream -> {
                responseRelay.relay(upstream, response);
                return null;
            });
            logger.debug("Proxy request to {} completed with status {}", targetUrl, response.getStatus());
        } catch (IOException e) {
            if (response.isCommitted()) {
                logger.error("Proxy request to {} failed after the response was committed", targetUrl, e);
                return;
            }
            logger.error("Error proxying request to {}", targetUrl, e);
            ErrorKind kind = ErrorKind.of(e);
            throw new EdgeException(kind, "Upstream unreachable: " + e.getMessage(), 0, null, e);
        }
    }

    private String targetUrl(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length() + PROXY_PREFIX.length());
        String target = upstreamApiUrl + path;
        if (request.getQueryString() != null) {
            target += "?" + request.getQueryString();
        }
        return target;
    }

    /**
     * Creates an HTTP request object based on the method name.
     */
    private static HttpUriRequestBase createProxyRequest(String method, String targetUrl) {
        return switch (method.toUpperCase(Locale.ROOT)) {
            case "GET" -> new HttpGet(targetUrl);
            case "POST" -> new HttpPost(targetUrl);
            case "PUT" -> new HttpPut(targetUrl);
            case "DELETE" -> new HttpDelete(targetUrl);
            case "PATCH" -> new HttpPatch(targetUrl);
            case "HEAD" -> new HttpHead(targetUrl);
            case "OPTIONS" -> new HttpOptions(targetUrl);
            default -> new HttpUriRequestBase(method.toUpperCase(Locale.ROOT), URI.create(targetUrl));
        };
    }

    /**
     * A body is forwarded whenever the client sent one, whatever the method.
     */
    private static boolean hasRequestBody(HttpServletRequest request) {
        return request.getContentLengthLong() > 0 || request.getHeader("Transfer-Encoding") != null;
    }

    /**
     * Copies client headers except credentials, cookies, hop-by-hop headers and the
     * identity headers, which are set from the session instead.
     */
    private static void copyRequestHeaders(HttpServletRequest request, HttpUriRequestBase proxyRequest) {
        Enumeration<String> headerNames = request.getHeaderNames();
        while (headerNames.hasMoreElements()) {
            String headerName = headerNames.nextElement();
            if (DROPPED_REQUEST_HEADERS.contains(headerName.toLowerCase(Locale.ROOT))
                    || IdentityHeadersRequestWrapper.isIdentityHeader(headerName)) {
                continue;
            }
            Enumeration<String> values = request.getHeaders(headerName);
            while (values.hasMoreElements()) {
                proxyRequest.addHeader(headerName, values.nextElement());
            }
        }
    }
}
