package com.numaansystems.crmedge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalised settings of the CRM edge gateway, bound from {@code crm.edge.*}.
 *
 * <h2>Groups</h2>
 * <ul>
 *   <li>{@code session}: cookie name, lifetime and signing secret</li>
 *   <li>{@code routing}: where authenticated users land by default</li>
 *   <li>{@code upstream}: base URL and HTTP timeouts of the CRM REST API</li>
 *   <li>{@code broker}: how early access tokens are refreshed</li>
 *   <li>{@code resilience}: retry and circuit breaker tuning for upstream calls</li>
 *   <li>{@code cors}: origins allowed to call the gateway with credentials</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@ConfigurationProperties(prefix = "crm.edge")
public class EdgeProperties {

    private DeploymentMode deploymentMode = DeploymentMode.DEVELOPMENT;
    private final Session session = new Session();
    private final Routing routing = new Routing();
    private final Upstream upstream = new Upstream();
    private final Broker broker = new Broker();
    private final Resilience resilience = new Resilience();
    private final Cors cors = new Cors();

    public DeploymentMode getDeploymentMode() {
        return deploymentMode;
    }

    public void setDeploymentMode(DeploymentMode deploymentMode) {
        this.deploymentMode = deploymentMode;
    }

    public Session getSession() {
        return session;
    }

    public Routing getRouting() {
        return routing;
    }

    public Upstream getUpstream() {
        return upstream;
    }

    public Broker getBroker() {
        return broker;
    }

    public Resilience getResilience() {
        return resilience;
    }

    public Cors getCors() {
        return cors;
    }

    public static class Session {
        /** Signing secret; empty means "resolve from SESSION_SECRET or the development key". */
        private String secret = "";
        private String cookieName = "crm_session";
        private int durationDays = 7;
        private boolean secureCookie = true;

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public String getCookieName() {
            return cookieName;
        }

        public void setCookieName(String cookieName) {
            this.cookieName = cookieName;
        }

        public int getDurationDays() {
            return durationDays;
        }

        public void setDurationDays(int durationDays) {
            this.durationDays = durationDays;
        }

        public boolean isSecureCookie() {
            return secureCookie;
        }

        public void setSecureCookie(boolean secureCookie) {
            this.secureCookie = secureCookie;
        }

        public Duration getDuration() {
            return Duration.ofDays(durationDays);
        }
    }

    public static class Routing {
        private String defaultAppPath = "/app/dashboard";

        public String getDefaultAppPath() {
            return defaultAppPath;
        }

        public void setDefaultAppPath(String defaultAppPath) {
            this.defaultAppPath = defaultAppPath;
        }
    }

    public static class Upstream {
        private String baseUrl = "";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration responseTimeout = Duration.ofSeconds(30);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getResponseTimeout() {
            return responseTimeout;
        }

        public void setResponseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
        }

        /**
         * @return the base URL without a trailing slash
         */
        public String normalizedBaseUrl() {
            String url = baseUrl == null ? "" : baseUrl.trim();
            while (url.endsWith("/")) {
                url = url.substring(0, url.length() - 1);
            }
            return url;
        }
    }

    public static class Broker {
        /** Access tokens closer than this to expiry are refreshed before forwarding. */
        private Duration refreshBuffer = Duration.ofSeconds(300);
        private Duration refreshTimeout = Duration.ofSeconds(10);

        public Duration getRefreshBuffer() {
            return refreshBuffer;
        }

        public void setRefreshBuffer(Duration refreshBuffer) {
            this.refreshBuffer = refreshBuffer;
        }

        public Duration getRefreshTimeout() {
            return refreshTimeout;
        }

        public void setRefreshTimeout(Duration refreshTimeout) {
            this.refreshTimeout = refreshTimeout;
        }
    }

    public static class Resilience {
        private final RetrySettings retry = new RetrySettings();
        private final CircuitBreakerSettings circuitBreaker = new CircuitBreakerSettings();

        public RetrySettings getRetry() {
            return retry;
        }

        public CircuitBreakerSettings getCircuitBreaker() {
            return circuitBreaker;
        }
    }

    public static class RetrySettings {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofMillis(200);
        private Duration maxDelay = Duration.ofSeconds(2);
        private double backoffMultiplier = 2.0;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }
    }

    public static class CircuitBreakerSettings {
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofSeconds(30);
        private int halfOpenProbeCount = 1;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getResetTimeout() {
            return resetTimeout;
        }

        public void setResetTimeout(Duration resetTimeout) {
            this.resetTimeout = resetTimeout;
        }

        public int getHalfOpenProbeCount() {
            return halfOpenProbeCount;
        }

        public void setHalfOpenProbeCount(int halfOpenProbeCount) {
            this.halfOpenProbeCount = halfOpenProbeCount;
        }
    }

    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }
    }
}
