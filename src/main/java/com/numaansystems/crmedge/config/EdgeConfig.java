package com.numaansystems.crmedge.config;

import com.numaansystems.crmedge.session.SessionCodec;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;

/**
 * Core beans of the gateway: the clock and the session codec.
 */
@Configuration
@EnableConfigurationProperties(EdgeProperties.class)
public class EdgeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * The codec is built once with the resolved secret; startup fails in production
     * mode when no secret is configured.
     */
    @Bean
    public SessionCodec sessionCodec(EdgeProperties properties, Environment environment, Clock clock) {
        String secret = new SigningSecretResolver(environment).resolve(properties);
        return new SessionCodec(secret, clock);
    }
}
