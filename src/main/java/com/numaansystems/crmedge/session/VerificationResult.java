package com.numaansystems.crmedge.session;

import java.util.Objects;

/**
 * Either a verified {@link SessionPayload} or the reason verification failed.
 */
public final class VerificationResult {

    private final SessionPayload payload;
    private final VerificationFailure failure;

    private VerificationResult(SessionPayload payload, VerificationFailure failure) {
        this.payload = payload;
        this.failure = failure;
    }

    public static VerificationResult valid(SessionPayload payload) {
        return new VerificationResult(Objects.requireNonNull(payload, "payload"), null);
    }

    public static VerificationResult invalid(VerificationFailure failure) {
        return new VerificationResult(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isValid() {
        return payload != null;
    }

    /**
     * @return the payload, or {@code null} when invalid
     */
    public SessionPayload getPayload() {
        return payload;
    }

    /**
     * @return the failure reason, or {@code null} when valid
     */
    public VerificationFailure getFailure() {
        return failure;
    }
}
