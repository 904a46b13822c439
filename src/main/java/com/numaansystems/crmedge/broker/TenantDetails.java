package com.numaansystems.crmedge.broker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Tenant as listed by {@code GET /api/v1/auth/tenants}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TenantDetails {
    public String id;
    public String name;
    public String slug;
    public String plan;
    public Boolean isActive;
    public Map<String, Object> settings;
    public String createdAt;
}
