package com.analytics.workflow.api;

import com.analytics.workflow.domain.model.ExecutionSnapshot;
import com.analytics.workflow.domain.model.TenantContext;
import com.analytics.workflow.domain.model.TriggerRequest;
import com.analytics.workflow.domain.model.TriggerResponse;
import com.analytics.workflow.domain.model.WorkflowDefinitionRequest;
import com.analytics.workflow.domain.model.WorkflowDefinitionResponse;
import com.analytics.workflow.domain.service.ExecutionQueryService;
import com.analytics.workflow.domain.service.WorkflowDefinitionService;
import com.analytics.workflow.domain.service.WorkflowTriggerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for workflow definitions and manual runs.
 * 
 * Endpoints:
 * - POST /api/v1/workflows - Create definition
 * - GET /api/v1/workflows - List definitions visible to the caller
 * - GET /api/v1/workflows/{id} - Get definition
 * - PUT /api/v1/workflows/{id} - Replace definition
 * - DELETE /api/v1/workflows/{id} - Delete definition (running executions stop)
 * - POST /api/v1/workflows/{id}/trigger - Start a manual execution
 * - GET /api/v1/workflows/{id}/executions - Execution history, newest first
 * 
 * Every call carries X-Tenant-Id and optionally X-Team-Id.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/workflows")
@RequiredArgsConstructor
public class WorkflowController {
    
    private final WorkflowDefinitionService definitionService;
    private final WorkflowTriggerService triggerService;
    private final ExecutionQueryService executionQueryService;
    
    @PostMapping
    public ResponseEntity<WorkflowDefinitionResponse> create(
            @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
            @RequestHeader(value = TenantHeaders.TEAM_ID, required = false) String teamId,
            @Valid @RequestBody WorkflowDefinitionRequest request) {
        
        log.info("Create workflow: tenant={}, name={}", tenantId, request.getName());
        
        WorkflowDefinitionResponse response = definitionService.create(TenantContext.of(tenantId, teamId), request);
        
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
    
    @GetMapping
    public ResponseEntity<List<WorkflowDefinitionResponse>> list(
            @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
            @RequestHeader(value = TenantHeaders.TEAM_ID, required = false) String teamId) {
        
        return ResponseEntity.ok(definitionService.list(TenantContext.of(tenantId, teamId)));
    }
    
    @GetMapping("/{workflowId}")
    public ResponseEntity<WorkflowDefinitionResponse> get(
            @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
            @RequestHeader(value = TenantHeaders.TEAM_ID, required = false) String teamId,
            @PathVariable String workflowId) {
        
        return ResponseEntity.ok(definitionService.get(TenantContext.of(tenantId, teamId), workflowId));
    }
    
    @PutMapping("/{workflowId}")
    public ResponseEntity<WorkflowDefinitionResponse> update(
            @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
            @RequestHeader(value = TenantHeaders.TEAM_ID, required = false) String teamId,
            @PathVariable String workflowId,
            @Valid @RequestBody WorkflowDefinitionRequest request) {
        
        log.info("Update workflow: tenant={}, workflowId={}", tenantId, workflowId);
        
        return ResponseEntity.ok(definitionService.update(TenantContext.of(tenantId, teamId), workflowId, request));
    }
    
    @DeleteMapping("/{workflowId}")
    public ResponseEntity<Void> delete(
            @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
            @RequestHeader(value = TenantHeaders.TEAM_ID, required = false) String teamId,
            @PathVariable String workflowId) {
        
        log.info("Delete workflow: tenant={}, workflowId={}", tenantId, workflowId);
        
        definitionService.delete(TenantContext.of(tenantId, teamId), workflowId);
        
        return ResponseEntity.noContent().build();
    }
    
    /**
     * Start a manual execution.
     * 
     * POST /api/v1/workflows/{id}/trigger
     * 
     * Optional body {"since": "2024-01-01", "until": "2024-01-03"} overrides
     * every source's date range for this run. Responds 202 with the new
     * executionId; progress follows over /ws/workflows.
     */
    @PostMapping("/{workflowId}/trigger")
    public ResponseEntity<TriggerResponse> trigger(
            @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
            @RequestHeader(value = TenantHeaders.TEAM_ID, required = false) String teamId,
            @PathVariable String workflowId,
            @Valid @RequestBody(required = false) TriggerRequest request) {
        
        log.info("Trigger workflow: tenant={}, workflowId={}", tenantId, workflowId);
        
        TriggerResponse response = triggerService.trigger(TenantContext.of(tenantId, teamId), workflowId, request);
        
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
    
    @GetMapping("/{workflowId}/executions")
    public ResponseEntity<List<ExecutionSnapshot>> executions(
            @RequestHeader(TenantHeaders.TENANT_ID) String tenantId,
            @RequestHeader(value = TenantHeaders.TEAM_ID, required = false) String teamId,
            @PathVariable String workflowId,
            @RequestParam(required = false) Integer limit) {
        
        return ResponseEntity.ok(
                executionQueryService.listForWorkflow(TenantContext.of(tenantId, teamId), workflowId, limit));
    }
}
