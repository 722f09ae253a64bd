package com.analytics.workflow.domain.model;

import lombok.Value;

/**
 * Tenant/team scope of a call into the engine.
 * 
 * Passed explicitly into every orchestration, tracking and query call; the
 * engine keeps no ambient "current tenant".
 */
@Value
public class TenantContext {
    
    String tenantId;
    String teamId;
    
    public static TenantContext of(String tenantId, String teamId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        return new TenantContext(tenantId, teamId == null || teamId.isBlank() ? null : teamId);
    }
    
    public static TenantContext of(String tenantId) {
        return of(tenantId, null);
    }
}
