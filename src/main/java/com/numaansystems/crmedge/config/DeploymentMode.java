package com.numaansystems.crmedge.config;

/**
 * Deployment mode of the gateway, set with {@code crm.edge.deployment-mode}.
 *
 * <p>Production mode refuses to start without a session secret and an upstream URL.</p>
 */
public enum DeploymentMode {
    DEVELOPMENT,
    PRODUCTION
}
