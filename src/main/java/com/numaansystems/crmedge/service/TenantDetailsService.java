package com.numaansystems.crmedge.service;

import com.numaansystems.crmedge.broker.TenantDetails;
import com.numaansystems.crmedge.broker.UpstreamAuthClient;
import com.numaansystems.crmedge.resilience.DegradedResult;
import com.numaansystems.crmedge.resilience.GracefulDegradation;
import com.numaansystems.crmedge.session.SessionPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Looks up the details of the session's current tenant.
 *
 * <p>The last good answer per tenant is kept in memory. When the upstream lookup fails
 * that answer is served and flagged stale; with nothing cached a minimal placeholder
 * tenant is returned so the application shell can still render.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class TenantDetailsService {

    private static final Logger logger = LoggerFactory.getLogger(TenantDetailsService.class);

    static final String PLACEHOLDER_NAME = "Mi Negocio";
    static final String PLACEHOLDER_SLUG = "mi-negocio";
    static final String DEFAULT_PLAN = "free";

    private final UpstreamAuthClient upstreamAuthClient;
    private final Clock clock;
    private final Map<String, TenantDetails> lastKnown = new ConcurrentHashMap<>();

    public TenantDetailsService(UpstreamAuthClient upstreamAuthClient, Clock clock) {
        this.upstreamAuthClient = upstreamAuthClient;
        this.clock = clock;
    }

    /**
     * @param payload an authenticated session with a tenant
     * @return the tenant, possibly stale or a placeholder
     */
    public DegradedResult<TenantDetails> currentTenant(SessionPayload payload) {
        String tenantId = payload.getTenantId();
        try {
            return GracefulDegradation.execute(
                    () -> findTenant(payload),
                    () -> Optional.ofNullable(lastKnown.get(tenantId)),
                    tenant -> lastKnown.put(tenantId, tenant));
        } catch (RuntimeException e) {
            logger.warn("Tenant {} unavailable and not cached, serving placeholder: {}", tenantId, e.getMessage());
            return DegradedResult.stale(placeholder(tenantId), e);
        }
    }

    private TenantDetails findTenant(SessionPayload payload) {
        List<TenantDetails> tenants = upstreamAuthClient.fetchTenants(payload.getAccessToken());
        for (TenantDetails tenant : tenants) {
            if (payload.getTenantId().equals(tenant.id)) {
                return withDefaults(tenant);
            }
        }
        logger.warn("Tenant {} not listed for user {}, using placeholder", payload.getTenantId(), payload.getUserId());
        return placeholder(payload.getTenantId());
    }

    private TenantDetails withDefaults(TenantDetails tenant) {
        TenantDetails result = new TenantDetails();
        result.id = tenant.id;
        result.name = tenant.name != null ? tenant.name : PLACEHOLDER_NAME;
        result.slug = tenant.slug != null ? tenant.slug : PLACEHOLDER_SLUG;
        result.plan = tenant.plan != null ? tenant.plan : DEFAULT_PLAN;
        result.isActive = tenant.isActive != null ? tenant.isActive : Boolean.TRUE;
        result.settings = tenant.settings;
        result.createdAt = tenant.createdAt != null ? tenant.createdAt : clock.instant().toString();
        return result;
    }

    TenantDetails placeholder(String tenantId) {
        TenantDetails tenant = new TenantDetails();
        tenant.id = tenantId;
        tenant.name = PLACEHOLDER_NAME;
        tenant.slug = PLACEHOLDER_SLUG;
        tenant.plan = DEFAULT_PLAN;
        tenant.isActive = Boolean.TRUE;
        tenant.createdAt = clock.instant().toString();
        return tenant;
    }
}
