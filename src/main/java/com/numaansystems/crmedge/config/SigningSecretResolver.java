package com.numaansystems.crmedge.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;

/**
 * Resolves the HMAC secret used to sign session cookies.
 *
 * <p>Lookup order:</p>
 * <ol>
 *   <li>{@code crm.edge.session.secret}</li>
 *   <li>the {@code SESSION_SECRET} environment variable</li>
 *   <li>a fixed development key, logged at WARN on every startup</li>
 * </ol>
 *
 * <p>In {@link DeploymentMode#PRODUCTION} the development key is never used: a missing
 * secret aborts startup with an {@link IllegalStateException}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class SigningSecretResolver {

    private static final Logger logger = LoggerFactory.getLogger(SigningSecretResolver.class);

    static final String SECRET_ENV_VARIABLE = "SESSION_SECRET";
    static final String DEVELOPMENT_SECRET = "crm-edge-dev-session-key-do-not-use-in-production";

    private final Environment environment;

    public SigningSecretResolver(Environment environment) {
        this.environment = environment;
    }

    public String resolve(EdgeProperties properties) {
        String configured = properties.getSession().getSecret();
        if (hasText(configured)) {
            logger.info("Session signing secret configured from crm.edge.session.secret");
            return configured;
        }

        String fromEnvironment = environment.getProperty(SECRET_ENV_VARIABLE);
        if (hasText(fromEnvironment)) {
            logger.info("Session signing secret configured from {}", SECRET_ENV_VARIABLE);
            return fromEnvironment;
        }

        if (properties.getDeploymentMode() == DeploymentMode.PRODUCTION) {
            throw new IllegalStateException(
                    "No session signing secret configured. Set crm.edge.session.secret or "
                            + SECRET_ENV_VARIABLE + " before starting in production mode");
        }

        logger.warn("WARNING: Session signing secret not configured. Using the development key.");
        logger.warn("WARNING: Set {} for any shared or production deployment.", SECRET_ENV_VARIABLE);
        return DEVELOPMENT_SECRET;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
