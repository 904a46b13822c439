package com.numaansystems.crmedge.session;

import java.util.Objects;

/**
 * Onboarding view of a session, with the defaults applied to sessions whose
 * signer left the onboarding claims out.
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>status: {@code completed} with a tenant, otherwise {@code not_started}</li>
 *   <li>step: {@code complete} with a tenant, otherwise {@code create-business}</li>
 *   <li>requiresOnboarding: {@code !tenant || status == not_started}</li>
 * </ul>
 *
 * <p>A session with a tenant and no onboarding claims resolves to app access.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public final class OnboardingState {

    public static final String STEP_COMPLETE = "complete";
    public static final String STEP_CREATE_BUSINESS = "create-business";

    private final OnboardingStatus status;
    private final String currentStep;
    private final boolean requiresOnboarding;

    public OnboardingState(OnboardingStatus status, String currentStep, boolean requiresOnboarding) {
        this.status = Objects.requireNonNull(status, "status");
        this.currentStep = currentStep != null ? currentStep : "";
        this.requiresOnboarding = requiresOnboarding;
    }

    /**
     * Derives the onboarding state from the session's optional claims.
     */
    public static OnboardingState from(SessionPayload payload) {
        boolean hasTenant = payload.hasTenant();

        OnboardingStatus status = payload.getOnboardingStatus() != null
                ? payload.getOnboardingStatus()
                : (hasTenant ? OnboardingStatus.COMPLETED : OnboardingStatus.NOT_STARTED);

        String step = payload.getOnboardingStep() != null && !payload.getOnboardingStep().isEmpty()
                ? payload.getOnboardingStep()
                : (hasTenant ? STEP_COMPLETE : STEP_CREATE_BUSINESS);

        boolean requires = payload.getRequiresOnboarding() != null
                ? payload.getRequiresOnboarding()
                : (!hasTenant || status == OnboardingStatus.NOT_STARTED);

        return new OnboardingState(status, step, requires);
    }

    public OnboardingStatus getStatus() {
        return status;
    }

    public String getCurrentStep() {
        return currentStep;
    }

    public boolean isRequiresOnboarding() {
        return requiresOnboarding;
    }

    /**
     * A user still has to go through onboarding only when it is required and not yet completed.
     */
    public boolean needsOnboarding() {
        return requiresOnboarding && status != OnboardingStatus.COMPLETED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OnboardingState other)) {
            return false;
        }
        return requiresOnboarding == other.requiresOnboarding
                && status == other.status
                && currentStep.equals(other.currentStep);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, currentStep, requiresOnboarding);
    }

    @Override
    public String toString() {
        return "OnboardingState{status=" + status.getValue() + ", step=" + currentStep
                + ", requiresOnboarding=" + requiresOnboarding + "}";
    }
}
