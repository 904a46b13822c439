package com.numaansystems.crmedge.config;

import com.numaansystems.crmedge.resilience.CircuitBreaker;
import com.numaansystems.crmedge.resilience.ErrorKind;
import com.numaansystems.crmedge.resilience.Retry;
import com.numaansystems.crmedge.resilience.RetryPolicy;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Outbound side of the gateway: the pooled HTTP client and the resilience settings
 * shared by every call to the upstream CRM API.
 *
 * <h2>Beans</h2>
 * <ul>
 *   <li>{@code upstreamHttpClient}: one pooled client, redirects and cookies disabled</li>
 *   <li>{@code upstreamCircuitBreaker}: one breaker for the upstream dependency</li>
 *   <li>{@code upstreamRetryPolicy} and {@code retry}: backoff for token refresh</li>
 *   <li>{@code upstreamExecutor}: threads for deadline-bounded blocking calls</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
public class UpstreamConfig {

    private static final Logger logger = LoggerFactory.getLogger(UpstreamConfig.class);

    /** Failures that say something about the health of the upstream itself. */
    public static final Set<ErrorKind> INFRASTRUCTURE_FAILURES =
            EnumSet.of(ErrorKind.NETWORK, ErrorKind.TIMEOUT, ErrorKind.OFFLINE, ErrorKind.UPSTREAM);

    @Bean(destroyMethod = "close")
    public CloseableHttpClient upstreamHttpClient(EdgeProperties properties) {
        EdgeProperties.Upstream upstream = properties.getUpstream();
        if (upstream.normalizedBaseUrl().isEmpty()) {
            if (properties.getDeploymentMode() == DeploymentMode.PRODUCTION) {
                throw new IllegalStateException("crm.edge.upstream.base-url must be set in production mode");
            }
            logger.warn("crm.edge.upstream.base-url is not configured; upstream calls will fail");
        }

        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.of(upstream.getConnectTimeout()))
                .build();
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(connectionConfig)
                .setMaxConnTotal(200)
                .setMaxConnPerRoute(100)
                .build();
        RequestConfig requestConfig = RequestConfig.custom()
                .setResponseTimeout(Timeout.of(upstream.getResponseTimeout()))
                .setRedirectsEnabled(false)
                .build();

        logger.info("Upstream HTTP client initialised for {}", upstream.normalizedBaseUrl());
        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .disableCookieManagement()
                .build();
    }

    @Bean
    public CircuitBreaker upstreamCircuitBreaker(EdgeProperties properties, Clock clock) {
        EdgeProperties.CircuitBreakerSettings settings = properties.getResilience().getCircuitBreaker();
        return new CircuitBreaker("upstream-api",
                settings.getFailureThreshold(),
                settings.getResetTimeout(),
                settings.getHalfOpenProbeCount(),
                error -> INFRASTRUCTURE_FAILURES.contains(ErrorKind.of(error)),
                clock);
    }

    @Bean
    public RetryPolicy upstreamRetryPolicy(EdgeProperties properties) {
        EdgeProperties.RetrySettings settings = properties.getResilience().getRetry();
        return new RetryPolicy(settings.getMaxAttempts(),
                settings.getInitialDelay(),
                settings.getMaxDelay(),
                settings.getBackoffMultiplier());
    }

    @Bean
    public Retry retry() {
        return new Retry();
    }

    @Bean(name = "upstreamExecutor", destroyMethod = "shutdown")
    public ExecutorService upstreamExecutor() {
        return Executors.newFixedThreadPool(16, new CustomizableThreadFactory("upstream-"));
    }
}
