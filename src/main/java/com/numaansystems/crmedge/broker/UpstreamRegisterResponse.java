package com.numaansystems.crmedge.broker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of {@code POST /api/v1/auth/register}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UpstreamRegisterResponse {
    /** Absent means the upstream expects an email confirmation. */
    public Boolean confirmationRequired;
    public UpstreamLoginResponse.User user;

    public boolean isConfirmationRequired() {
        return confirmationRequired == null || confirmationRequired;
    }
}
