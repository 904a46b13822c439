package com.numaansystems.crmedge.session;

import java.util.List;
import java.util.Objects;

/**
 * Content of the signed session token.
 *
 * <p>Identity fields ({@code userId}, {@code email}, {@code tenantId}, {@code role})
 * never change after login. Token rotation produces a copy through
 * {@link #withRotatedTokens(String, String, Long)}. The onboarding claims are kept
 * exactly as signed (possibly {@code null}); {@link #onboardingState()} applies the
 * defaults.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public final class SessionPayload {

    private final String userId;
    private final String email;
    private final String tenantId;
    private final String role;
    private final List<String> permissions;
    private final String accessToken;
    private final String refreshToken;
    private final Long accessTokenExpiresAt;
    private final long sessionExpiresAt;
    private final long createdAt;
    private final OnboardingStatus onboardingStatus;
    private final String onboardingStep;
    private final Boolean requiresOnboarding;

    private SessionPayload(Builder builder) {
        this.userId = builder.userId;
        this.email = builder.email != null ? builder.email : "";
        this.tenantId = builder.tenantId != null ? builder.tenantId : "";
        this.role = builder.role != null ? builder.role : "viewer";
        this.permissions = builder.permissions != null
                ? List.copyOf(builder.permissions)
                : null;
        this.accessToken = builder.accessToken != null ? builder.accessToken : "";
        this.refreshToken = builder.refreshToken != null ? builder.refreshToken : "";
        this.accessTokenExpiresAt = builder.accessTokenExpiresAt;
        this.sessionExpiresAt = builder.sessionExpiresAt;
        this.createdAt = builder.createdAt;
        this.onboardingStatus = builder.onboardingStatus;
        this.onboardingStep = builder.onboardingStep;
        this.requiresOnboarding = builder.requiresOnboarding;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .userId(userId)
                .email(email)
                .tenantId(tenantId)
                .role(role)
                .permissions(permissions)
                .accessToken(accessToken)
                .refreshToken(refreshToken)
                .accessTokenExpiresAt(accessTokenExpiresAt)
                .sessionExpiresAt(sessionExpiresAt)
                .createdAt(createdAt)
                .onboardingStatus(onboardingStatus)
                .onboardingStep(onboardingStep)
                .requiresOnboarding(requiresOnboarding);
    }

    /**
     * Copy with new backend tokens; identity, onboarding and session expiry are unchanged.
     */
    public SessionPayload withRotatedTokens(String newAccessToken, String newRefreshToken, Long newAccessTokenExpiresAt) {
        return toBuilder()
                .accessToken(newAccessToken)
                .refreshToken(newRefreshToken)
                .accessTokenExpiresAt(newAccessTokenExpiresAt)
                .build();
    }

    public boolean hasTenant() {
        return !tenantId.isEmpty();
    }

    public OnboardingState onboardingState() {
        return OnboardingState.from(this);
    }

    public String getUserId() {
        return userId;
    }

    public String getEmail() {
        return email;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getRole() {
        return role;
    }

    public List<String> getPermissions() {
        return permissions;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public Long getAccessTokenExpiresAt() {
        return accessTokenExpiresAt;
    }

    /**
     * @return epoch seconds after which the session is invalid, {@code 0} when unset
     */
    public long getSessionExpiresAt() {
        return sessionExpiresAt;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public OnboardingStatus getOnboardingStatus() {
        return onboardingStatus;
    }

    public String getOnboardingStep() {
        return onboardingStep;
    }

    public Boolean getRequiresOnboarding() {
        return requiresOnboarding;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SessionPayload that)) {
            return false;
        }
        return sessionExpiresAt == that.sessionExpiresAt
                && createdAt == that.createdAt
                && Objects.equals(userId, that.userId)
                && email.equals(that.email)
                && tenantId.equals(that.tenantId)
                && role.equals(that.role)
                && Objects.equals(permissions, that.permissions)
                && accessToken.equals(that.accessToken)
                && refreshToken.equals(that.refreshToken)
                && Objects.equals(accessTokenExpiresAt, that.accessTokenExpiresAt)
                && onboardingStatus == that.onboardingStatus
                && Objects.equals(onboardingStep, that.onboardingStep)
                && Objects.equals(requiresOnboarding, that.requiresOnboarding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, email, tenantId, role, permissions, accessToken, refreshToken,
                accessTokenExpiresAt, sessionExpiresAt, createdAt, onboardingStatus, onboardingStep,
                requiresOnboarding);
    }

    // Tokens are left out on purpose.
    @Override
    public String toString() {
        return "SessionPayload{userId=" + userId + ", tenantId=" + tenantId + ", role=" + role
                + ", sessionExpiresAt=" + sessionExpiresAt + ", onboardingStatus=" + onboardingStatus + "}";
    }

    public static final class Builder {
        private String userId;
        private String email;
        private String tenantId;
        private String role;
        private List<String> permissions;
        private String accessToken;
        private String refreshToken;
        private Long accessTokenExpiresAt;
        private long sessionExpiresAt;
        private long createdAt;
        private OnboardingStatus onboardingStatus;
        private String onboardingStep;
        private Boolean requiresOnboarding;

        private Builder() {
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder permissions(List<String> permissions) {
            this.permissions = permissions;
            return this;
        }

        public Builder accessToken(String accessToken) {
            this.accessToken = accessToken;
            return this;
        }

        public Builder refreshToken(String refreshToken) {
            this.refreshToken = refreshToken;
            return this;
        }

        public Builder accessTokenExpiresAt(Long accessTokenExpiresAt) {
            this.accessTokenExpiresAt = accessTokenExpiresAt;
            return this;
        }

        public Builder sessionExpiresAt(long sessionExpiresAt) {
            this.sessionExpiresAt = sessionExpiresAt;
            return this;
        }

        public Builder createdAt(long createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder onboardingStatus(OnboardingStatus onboardingStatus) {
            this.onboardingStatus = onboardingStatus;
            return this;
        }

        public Builder onboardingStep(String onboardingStep) {
            this.onboardingStep = onboardingStep;
            return this;
        }

        public Builder requiresOnboarding(Boolean requiresOnboarding) {
            this.requiresOnboarding = requiresOnboarding;
            return this;
        }

        /**
         * @throws IllegalStateException when {@code userId} is missing
         */
        public SessionPayload build() {
            if (userId == null || userId.isEmpty()) {
                throw new IllegalStateException("userId is required");
            }
            return new SessionPayload(this);
        }
    }
}
