package com.analytics.workflow.domain.service;

import com.analytics.workflow.domain.exception.ValidationException;
import com.analytics.workflow.domain.model.DateRangeSpec;
import com.analytics.workflow.domain.model.ExecutionSnapshot;
import com.analytics.workflow.domain.model.ExecutionStatus;
import com.analytics.workflow.domain.model.TenantContext;
import com.analytics.workflow.domain.model.TriggerRequest;
import com.analytics.workflow.domain.model.TriggerResponse;
import com.analytics.workflow.domain.model.TriggerType;
import com.analytics.workflow.domain.service.ExecutionRegistry.ActiveExecution;
import com.analytics.workflow.infrastructure.persistence.entity.WorkflowDefinitionEntity;
import com.analytics.workflow.infrastructure.persistence.entity.WorkflowExecutionEntity;
import com.analytics.workflow.infrastructure.persistence.repository.WorkflowExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Manual trigger and cancel of executions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowTriggerService {
    
    private final WorkflowDefinitionService definitionService;
    private final ExecutionQueryService executionQueryService;
    private final WorkflowOrchestrator orchestrator;
    private final ExecutionRegistry executionRegistry;
    private final WorkflowExecutionRepository executionRepository;
    private final DateRangeResolver dateRangeResolver;
    private final Clock clock;
    
    /**
     * Starts a MANUAL execution. since/until, when given, must come as a
     * pair and replace the configured ranges for this run only.
     *
     * @throws ValidationException for a disabled workflow or a bad override
     */
    public TriggerResponse trigger(TenantContext tenant, String workflowId, TriggerRequest request) {
        WorkflowDefinitionEntity definition = definitionService.findEntity(tenant, workflowId);
        if (!definition.isEnabled()) {
            throw new ValidationException("Workflow " + workflowId + " is disabled");
        }
        
        DateRangeSpec override = toOverride(request);
        String executionId = orchestrator.start(definition, TriggerType.MANUAL, tenant, override);
        
        log.info("Manual trigger of workflow {} started execution {} (override: {})",
                workflowId, executionId, override != null);
        return new TriggerResponse(executionId, definition.getId().toString(), ExecutionStatus.PENDING);
    }
    
    /**
     * Requests cancellation of a PENDING or RUNNING execution.
     * 
     * A run owned by this process stops cooperatively at its next boundary,
     * so the returned snapshot may still read RUNNING. A record no live run
     * owns is moved to CANCELLED directly.
     *
     * @throws ValidationException when the execution is already terminal
     */
    @Transactional
    public ExecutionSnapshot cancel(TenantContext tenant, String executionId) {
        WorkflowExecutionEntity entity = executionQueryService.findEntity(tenant, executionId);
        String id = entity.getId().toString();
        
        Optional<ActiveExecution> active = executionRegistry.find(id);
        if (active.isPresent()) {
            ExecutionTracker tracker = active.get().getTracker();
            if (tracker.getStatus().isTerminal()) {
                throw new ValidationException(
                        "Execution " + id + " cannot be cancelled in state " + tracker.getStatus());
            }
            executionRegistry.requestCancel(id);
            log.info("Cancellation requested for execution {}", id);
            return tracker.snapshot();
        }
        
        if (entity.getStatus().isTerminal()) {
            throw new ValidationException(
                    "Execution " + id + " cannot be cancelled in state " + entity.getStatus());
        }
        
        Instant now = clock.instant();
        entity.setStatus(entity.getStatus().transitionTo(ExecutionStatus.CANCELLED));
        entity.setCompletedAt(now);
        if (entity.getStartedAt() != null) {
            entity.setDurationMs(now.toEpochMilli() - entity.getStartedAt().toEpochMilli());
        }
        executionRepository.save(entity);
        log.info("Execution {} not owned by a live run, cancelled in store", id);
        return ExecutionQueryService.toSnapshot(entity);
    }
    
    private DateRangeSpec toOverride(TriggerRequest request) {
        if (request == null || !request.hasOverride()) {
            return null;
        }
        if (request.getSince() == null || request.getUntil() == null) {
            throw new ValidationException("since and until must be given together");
        }
        DateRangeSpec override = DateRangeSpec.absolute(request.getSince(), request.getUntil());
        dateRangeResolver.resolve(override, dateRangeResolver.today());
        return override;
    }
}
