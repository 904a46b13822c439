package com.numaansystems.crmedge.session;

import java.util.Optional;

/**
 * Progress of a tenant through the guided setup flow, in the wire format used by the session claims.
 */
public enum OnboardingStatus {

    NOT_STARTED("not_started"),
    PROFILE_CREATED("profile_created"),
    BUSINESS_CREATED("business_created"),
    SETUP_COMPLETED("setup_completed"),
    TEAM_INVITED("team_invited"),
    COMPLETED("completed");

    private final String value;

    OnboardingStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<OnboardingStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (OnboardingStatus status : values()) {
            if (status.value.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
