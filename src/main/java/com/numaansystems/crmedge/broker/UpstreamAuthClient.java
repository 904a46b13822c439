package com.numaansystems.crmedge.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.crmedge.config.EdgeProperties;
import com.numaansystems.crmedge.resilience.CircuitBreaker;
import com.numaansystems.crmedge.resilience.EdgeException;
import com.numaansystems.crmedge.resilience.Retry;
import com.numaansystems.crmedge.resilience.RetryPolicy;
import com.numaansystems.crmedge.resilience.Timeouts;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * HTTP client for the authentication endpoints of the upstream CRM API.
 *
 * <p>All calls go through the shared upstream {@link CircuitBreaker}. Token refresh is
 * additionally retried with backoff and bounded by an overall deadline, since a failed
 * refresh ends the user's session.</p>
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>{@code POST /api/v1/auth/refresh}</li>
 *   <li>{@code POST /api/v1/auth/login}</li>
 *   <li>{@code POST /api/v1/auth/register}</li>
 *   <li>{@code GET /api/v1/auth/me} (per tenant)</li>
 *   <li>{@code POST /api/v1/auth/logout} (best effort)</li>
 *   <li>{@code GET /api/v1/auth/tenants}</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class UpstreamAuthClient {

    private static final Logger logger = LoggerFactory.getLogger(UpstreamAuthClient.class);

    public static final String API_PREFIX = "/api/v1";

    static final String TENANT_HEADER = "x-tenant-id";

    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final RetryPolicy retryPolicy;
    private final Executor upstreamExecutor;
    private final String baseUrl;
    private final Duration refreshTimeout;

    public UpstreamAuthClient(CloseableHttpClient httpClient,
                              ObjectMapper objectMapper,
                              CircuitBreaker circuitBreaker,
                              Retry retry,
                              RetryPolicy retryPolicy,
                              @Qualifier("upstreamExecutor") Executor upstreamExecutor,
                              EdgeProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreaker;
        this.retry = retry;
        this.retryPolicy = retryPolicy;
        this.upstreamExecutor = upstreamExecutor;
        this.baseUrl = properties.getUpstream().normalizedBaseUrl();
        this.refreshTimeout = properties.getBroker().getRefreshTimeout();
    }

    /**
     * Exchanges a refresh token for a new token pair.
     *
     * @throws EdgeException on a non-2xx answer, network failure, timeout or open circuit
     */
    public TokenRefreshResponse refresh(String refreshToken) {
        JavaType type = objectMapper.constructType(TokenRefreshResponse.class);
        return circuitBreaker.execute(() -> retry.execute(
                () -> Timeouts.call(() -> send(jsonPost("/auth/refresh", Map.of("refreshToken", refreshToken)), type),
                        refreshTimeout,
                        "Token refresh timed out after " + refreshTimeout.toMillis() + " ms", upstreamExecutor),
                retryPolicy));
    }

    /**
     * Authenticates with email and password.
     *
     * @throws UpstreamStatusException when the upstream rejects the credentials
     */
    public UpstreamLoginResponse login(String email, String password) {
        HttpPost request = jsonPost("/auth/login", Map.of("email", email, "password", password));
        JavaType type = objectMapper.constructType(UpstreamLoginResponse.class);
        return circuitBreaker.execute(() -> send(request, type));
    }

    /**
     * Creates an account. No session is started; the upstream usually asks for an email
     * confirmation first.
     *
     * @param fullName optional display name, left out of the request when {@code null}
     * @throws UpstreamStatusException when the upstream rejects the registration
     */
    public UpstreamRegisterResponse register(String email, String password, String fullName) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("email", email);
        body.put("password", password);
        if (fullName != null) {
            body.put("fullName", fullName);
        }
        HttpPost request = jsonPost("/auth/register", body);
        JavaType type = objectMapper.constructType(UpstreamRegisterResponse.class);
        UpstreamRegisterResponse response = circuitBreaker.execute(() -> send(request, type));
        return response != null ? response : new UpstreamRegisterResponse();
    }

    /**
     * Role of the token's user within {@code tenantId}, read from the profile endpoint.
     * The profile may be wrapped in a {@code data} envelope.
     *
     * @return the role, or {@code null} when the profile carries none
     * @throws UpstreamStatusException when the user is not a member of the tenant
     */
    public String fetchTenantRole(String accessToken, String tenantId) {
        HttpGet request = new HttpGet(baseUrl + API_PREFIX + "/auth/me");
        request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken);
        request.setHeader(TENANT_HEADER, tenantId);
        JavaType type = objectMapper.constructType(JsonNode.class);
        JsonNode profile = circuitBreaker.execute(() -> send(request, type));
        if (profile == null) {
            return null;
        }
        JsonNode user = profile.path("data").isObject() ? profile.get("data") : profile;
        JsonNode role = user.get("role");
        return role != null && role.isTextual() && !role.asText().isEmpty() ? role.asText() : null;
    }

    /**
     * Revokes the upstream session. Failures are logged and otherwise ignored.
     */
    public void logout(String accessToken) {
        if (accessToken == null || accessToken.isEmpty()) {
            return;
        }
        HttpPost request = new HttpPost(baseUrl + API_PREFIX + "/auth/logout");
        request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken);
        try {
            circuitBreaker.execute(() -> send(request, null));
        } catch (RuntimeException e) {
            logger.warn("Upstream logout failed, continuing with local logout: {}", e.getMessage());
        }
    }

    /**
     * Lists the tenants of the authenticated user.
     */
    public List<TenantDetails> fetchTenants(String accessToken) {
        HttpGet request = new HttpGet(baseUrl + API_PREFIX + "/auth/tenants");
        request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken);
        JavaType type = objectMapper.getTypeFactory().constructCollectionType(List.class, TenantDetails.class);
        List<TenantDetails> tenants = circuitBreaker.execute(() -> send(request, type));
        return tenants != null ? tenants : List.of();
    }

    private HttpPost jsonPost(String path, Map<String, String> body) {
        HttpPost request = new HttpPost(baseUrl + API_PREFIX + path);
        try {
            request.setEntity(new StringEntity(objectMapper.writeValueAsString(body), ContentType.APPLICATION_JSON));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialise request body", e);
        }
        return request;
    }

    private <T> T send(HttpUriRequestBase request, JavaType type) throws IOException {
        logger.debug("Calling upstream {} {}", request.getMethod(), request.getRequestUri());
        return httpClient.execute(request, response -> {
            int status = response.getCode();
            String body = response.getEntity() != null
                    ? EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8)
                    : "";
            if (status < 200 || status >= 300) {
                throw statusFailure(status, body);
            }
            if (type == null || body.isBlank()) {
                return null;
            }
            return objectMapper.readValue(body, type);
        });
    }

    private UpstreamStatusException statusFailure(int status, String body) {
        String message = null;
        String code = null;
        if (!body.isBlank()) {
            try {
                JsonNode json = objectMapper.readTree(body);
                message = json.hasNonNull("message") ? json.get("message").asText() : null;
                code = json.hasNonNull("code") ? json.get("code").asText() : null;
            } catch (JsonProcessingException e) {
                logger.debug("Upstream error body is not JSON: {}", e.getOriginalMessage());
            }
        }
        logger.warn("Upstream responded with HTTP {}{}", status, code != null ? " (" + code + ")" : "");
        return new UpstreamStatusException(status, message, code);
    }
}
