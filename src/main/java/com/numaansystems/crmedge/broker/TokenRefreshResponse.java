package com.numaansystems.crmedge.broker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of {@code POST /api/v1/auth/refresh}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenRefreshResponse {
    public String accessToken;
    public String refreshToken;
    /** Lifetime of the new access token in seconds. */
    public Long expiresIn;
    /** Expiry of the new access token, epoch seconds. */
    public Long expiresAt;
}
