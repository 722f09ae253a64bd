package com.analytics.workflow.domain.model;

import lombok.Value;

/**
 * Identity of one running execution, handed to fetchers and listeners.
 */
@Value
public class ExecutionContext {
    
    String executionId;
    String workflowId;
    TenantContext tenant;
    
    public String getTenantId() {
        return tenant.getTenantId();
    }
    
    public String getTeamId() {
        return tenant.getTeamId();
    }
}
