package com.analytics.workflow.api;

/**
 * Request headers carrying the caller's tenant and team.
 */
final class TenantHeaders {
    
    static final String TENANT_ID = "X-Tenant-Id";
    static final String TEAM_ID = "X-Team-Id";
    
    private TenantHeaders() {
    }
}
