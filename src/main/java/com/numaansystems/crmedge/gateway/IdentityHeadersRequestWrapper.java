package com.numaansystems.crmedge.gateway;

import com.numaansystems.crmedge.session.OnboardingState;
import com.numaansystems.crmedge.session.SessionPayload;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Request wrapper that carries the verified identity downstream as headers.
 *
 * <p>Client-supplied copies of the identity headers are always hidden. When a session is
 * present the real values replace them. Tokens are never exposed as headers.</p>
 */
public class IdentityHeadersRequestWrapper extends HttpServletRequestWrapper {

    public static final String USER_ID = "x-user-id";
    public static final String TENANT_ID = "x-tenant-id";
    public static final String USER_ROLE = "x-user-role";
    public static final String ONBOARDING_STATUS = "x-onboarding-status";
    public static final String ONBOARDING_STEP = "x-onboarding-step";
    public static final String REQUIRES_ONBOARDING = "x-requires-onboarding";

    static final Set<String> IDENTITY_HEADERS = Set.of(
            USER_ID, TENANT_ID, USER_ROLE, ONBOARDING_STATUS, ONBOARDING_STEP, REQUIRES_ONBOARDING);

    // keyed by lower-case name
    private final Map<String, String> identity;

    public IdentityHeadersRequestWrapper(HttpServletRequest request, SessionPayload payload) {
        super(request);
        this.identity = payload != null ? identityOf(payload) : Collections.emptyMap();
    }

    public static boolean isIdentityHeader(String name) {
        return name != null && IDENTITY_HEADERS.contains(name.toLowerCase(Locale.ROOT));
    }

    @Override
    public String getHeader(String name) {
        if (isIdentityHeader(name)) {
            return identity.get(name.toLowerCase(Locale.ROOT));
        }
        return super.getHeader(name);
    }

    @Override
    public Enumeration<String> getHeaders(String name) {
        if (isIdentityHeader(name)) {
            String value = identity.get(name.toLowerCase(Locale.ROOT));
            return Collections.enumeration(value != null ? List.of(value) : List.of());
        }
        return super.getHeaders(name);
    }

    @Override
    public Enumeration<String> getHeaderNames() {
        List<String> names = new ArrayList<>();
        Enumeration<String> original = super.getHeaderNames();
        while (original != null && original.hasMoreElements()) {
            String name = original.nextElement();
            if (!isIdentityHeader(name)) {
                names.add(name);
            }
        }
        names.addAll(identity.keySet());
        return Collections.enumeration(names);
    }

    private static Map<String, String> identityOf(SessionPayload payload) {
        OnboardingState state = payload.onboardingState();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(USER_ID, payload.getUserId());
        headers.put(TENANT_ID, payload.getTenantId());
        headers.put(USER_ROLE, payload.getRole());
        headers.put(ONBOARDING_STATUS, state.getStatus().getValue());
        headers.put(ONBOARDING_STEP, state.getCurrentStep());
        headers.put(REQUIRES_ONBOARDING, Boolean.toString(state.isRequiresOnboarding()));
        return headers;
    }
}
