package com.numaansystems.crmedge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CRM Edge Gateway Application
 *
 * <p>Request-time authentication and resilience layer in front of the multi-tenant CRM
 * single-page application and its upstream REST API.</p>
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Verifies the signed session cookie on every request</li>
 *   <li>Routes users to login, onboarding or the app based on their session</li>
 *   <li>Proxies API calls upstream, refreshing access tokens before they expire</li>
 *   <li>Guards upstream calls with retry, timeouts and a circuit breaker</li>
 * </ul>
 *
 * <h2>Request flow</h2>
 * <ol>
 *   <li>Browser request reaches the edge filter</li>
 *   <li>Session cookie verified and the route classified</li>
 *   <li>Redirect, or continue with verified identity headers</li>
 *   <li>API proxy calls refresh credentials if needed and forward upstream</li>
 *   <li>Upstream response relayed, session cookie rewritten on rotation</li>
 * </ol>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@SpringBootApplication
public class CrmEdgeApplication {

    /**
     * Main entry point for the CRM edge gateway.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(CrmEdgeApplication.class, args);
    }
}
