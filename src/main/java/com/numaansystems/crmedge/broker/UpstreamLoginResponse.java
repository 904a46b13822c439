package com.numaansystems.crmedge.broker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Body of {@code POST /api/v1/auth/login}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UpstreamLoginResponse {
    public User user;
    public Tokens session;
    public List<TenantMembership> tenants;
    public Onboarding onboarding;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class User {
        public String id;
        public String email;
        public String fullName;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Tokens {
        public String accessToken;
        public String refreshToken;
        public Long expiresIn;
        public Long expiresAt;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TenantMembership {
        public String id;
        public String name;
        public String slug;
        public String role;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Onboarding {
        public String status;
        public String currentStep;
        public Boolean requiresOnboarding;
    }
}
