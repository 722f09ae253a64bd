package com.analytics.workflow.api;

import com.analytics.workflow.domain.model.ExecutionProgress;
import com.analytics.workflow.domain.model.ExecutionSnapshot;
import com.analytics.workflow.domain.model.TenantContext;
import com.analytics.workflow.domain.service.ExecutionQueryService;
import com.analytics.workflow.domain.service.WorkflowTriggerService;
import com.analytics.workflow.infrastructure.persistence.entity.ExecutionLogEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for individual executions.
 * 
 * Endpoints:
 * - GET /api/v1/executions/{id} - Snapshot (live when the run is active)
 * - POST /api/v1/executions/{id}/cancel - Request cancellation
 * - GET /api/v1/executions/{id}/progress - Cached progress view
 * - GET /api/v1/executions/{id}/logs?limit=100 - Event log, newest first
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/executions")
@RequiredArgsConstructor
public class ExecutionController {
    
    private final ExecutionQueryService executionQueryService;
    private final WorkflowTriggerService triggerService;
    
    @GetMapping("/{executionId}")
    public ResponseEntity<ExecutionSnapshot> get(
            @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
            @RequestHeader(value = TenantHeaders.TEAM_ID, required = false) String teamId,
            @PathVariable String executionId) {
        
        return ResponseEntity.ok(executionQueryService.get(TenantContext.of(tenantId, teamId), executionId));
    }
    
    /**
     * Cancel a pending or running execution.
     * 
     * An active run stops at its next day or source boundary, so the
     * returned snapshot may still show RUNNING.
     */
    @PostMapping("/{executionId}/cancel")
    public ResponseEntity<ExecutionSnapshot> cancel(
            @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
            @RequestHeader(value = TenantHeaders.TEAM_ID, required = false) String teamId,
            @PathVariable String executionId) {
        
        log.info("Cancel execution: tenant={}, executionId={}", tenantId, executionId);
        
        return ResponseEntity.ok(triggerService.cancel(TenantContext.of(tenantId, teamId), executionId));
    }
    
    @GetMapping("/{executionId}/progress")
    public ResponseEntity<ExecutionProgress> progress(
            @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
            @RequestHeader(value = TenantHeaders.TEAM_ID, required = false) String teamId,
            @PathVariable String executionId) {
        
        return ResponseEntity.ok(executionQueryService.progress(TenantContext.of(tenantId, teamId), executionId));
    }
    
    @GetMapping("/{executionId}/logs")
    public ResponseEntity<List<ExecutionLogEntity>> logs(
            @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
            @RequestHeader(value = TenantHeaders.TEAM_ID, required = false) String teamId,
            @PathVariable String executionId,
            @RequestParam(required = false) Integer limit) {
        
        return ResponseEntity.ok(executionQueryService.logs(TenantContext.of(tenantId, teamId), executionId, limit));
    }
}
