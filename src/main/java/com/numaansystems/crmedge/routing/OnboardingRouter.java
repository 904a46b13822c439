package com.numaansystems.crmedge.routing;

import com.numaansystems.crmedge.session.OnboardingState;
import com.numaansystems.crmedge.session.OnboardingStatus;

/**
 * Decides where an authenticated user must land: an onboarding step or the app.
 *
 * <p>Resolution is a pure function of its arguments. Feeding a resolved path back in
 * as the intended path yields the same path.</p>
 *
 * <h2>Rules</h2>
 * <ol>
 *   <li>Onboarding required and not completed: the page for the current step.</li>
 *   <li>Otherwise, with a tenant: the intended path when it targets {@code /app},
 *       else the default app path.</li>
 *   <li>Otherwise: tenant creation.</li>
 * </ol>
 *
 * <h2>Step table</h2>
 * <ul>
 *   <li>{@code signup}, {@code create-business}: {@value #CREATE_BUSINESS_PATH}</li>
 *   <li>{@code branding}, {@code modules}, {@code business-hours}: {@value #SETUP_PATH}</li>
 *   <li>{@code invite-team}: {@value #INVITE_TEAM_PATH}</li>
 *   <li>{@code complete}: {@value #COMPLETE_PATH}</li>
 *   <li>anything else: setup with a tenant, tenant creation without</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public final class OnboardingRouter {

    public static final String CREATE_BUSINESS_PATH = "/onboarding/create-business";
    public static final String SETUP_PATH = "/onboarding/setup";
    public static final String INVITE_TEAM_PATH = "/onboarding/invite-team";
    public static final String COMPLETE_PATH = "/onboarding/complete";

    private OnboardingRouter() {
    }

    /**
     * @param state the session's onboarding state, defaults applied
     * @param hasTenant whether the session carries a tenant
     * @param intendedPath where the user was heading, may be {@code null}
     * @param defaultAppPath landing page inside the app
     * @return the path to redirect to
     */
    public static String resolveDestination(OnboardingState state, boolean hasTenant,
                                            String intendedPath, String defaultAppPath) {
        if (state.needsOnboarding()) {
            return stepPath(state.getCurrentStep(), hasTenant);
        }
        if (hasTenant) {
            return RouteClassifier.isAppPath(intendedPath) ? intendedPath : defaultAppPath;
        }
        return CREATE_BUSINESS_PATH;
    }

    /**
     * The onboarding page for a user who already owns a tenant and asks for the
     * tenant-creation form again.
     */
    public static String nextStepAfterBusinessCreation(OnboardingState state) {
        if (state.getStatus() == OnboardingStatus.COMPLETED || !state.isRequiresOnboarding()) {
            return SETUP_PATH;
        }
        String path = stepPath(state.getCurrentStep(), true);
        return CREATE_BUSINESS_PATH.equals(path) ? SETUP_PATH : path;
    }

    static String stepPath(String step, boolean hasTenant) {
        return switch (step == null ? "" : step) {
            case "signup", "create-business" -> CREATE_BUSINESS_PATH;
            case "branding", "modules", "business-hours" -> SETUP_PATH;
            case "invite-team" -> INVITE_TEAM_PATH;
            case "complete" -> COMPLETE_PATH;
            default -> hasTenant ? SETUP_PATH : CREATE_BUSINESS_PATH;
        };
    }
}
