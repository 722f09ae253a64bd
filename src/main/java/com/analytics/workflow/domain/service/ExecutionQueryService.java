package com.analytics.workflow.domain.service;

import com.analytics.workflow.domain.exception.ExecutionNotFoundException;
import com.analytics.workflow.domain.model.ExecutionProgress;
import com.analytics.workflow.domain.model.ExecutionSnapshot;
import com.analytics.workflow.domain.model.SourceCounters;
import com.analytics.workflow.domain.model.SourceKey;
import com.analytics.workflow.domain.model.TenantContext;
import com.analytics.workflow.infrastructure.cache.ExecutionProgressCache;
import com.analytics.workflow.infrastructure.persistence.entity.ExecutionLogEntity;
import com.analytics.workflow.infrastructure.persistence.entity.WorkflowDefinitionEntity;
import com.analytics.workflow.infrastructure.persistence.entity.WorkflowExecutionEntity;
import com.analytics.workflow.infrastructure.persistence.repository.WorkflowExecutionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read side of executions.
 * 
 * Executions owned by this process are answered from the live tracker;
 * everything else from the stored record.
 */
@Service
@RequiredArgsConstructor
public class ExecutionQueryService {
    
    private static final int DEFAULT_LIST_LIMIT = 50;
    private static final int MAX_LIST_LIMIT = 500;
    
    private final WorkflowExecutionRepository executionRepository;
    private final WorkflowDefinitionService definitionService;
    private final ExecutionRegistry executionRegistry;
    private final ExecutionProgressCache progressCache;
    private final ExecutionLogService logService;
    private final Clock clock;
    
    @Transactional(readOnly = true)
    public ExecutionSnapshot get(TenantContext tenant, String executionId) {
        WorkflowExecutionEntity entity = findEntity(tenant, executionId);
        return executionRegistry.find(entity.getId().toString())
                .map(active -> active.getTracker().snapshot())
                .orElseGet(() -> toSnapshot(entity));
    }
    
    @Transactional(readOnly = true)
    public List<ExecutionSnapshot> listForWorkflow(TenantContext tenant, String workflowId, Integer limit) {
        WorkflowDefinitionEntity definition = definitionService.findEntity(tenant, workflowId);
        int size = limit == null || limit <= 0 ? DEFAULT_LIST_LIMIT : Math.min(limit, MAX_LIST_LIMIT);
        return executionRepository
                .findByWorkflowIdAndTenantIdOrderByCreatedAtDesc(definition.getId(), tenant.getTenantId(),
                        PageRequest.of(0, size))
                .stream()
                .map(ExecutionQueryService::toSnapshot)
                .collect(Collectors.toList());
    }
    
    /**
     * Cached progress when available, otherwise computed from the record.
     */
    @Transactional(readOnly = true)
    public ExecutionProgress progress(TenantContext tenant, String executionId) {
        WorkflowExecutionEntity entity = findEntity(tenant, executionId);
        Optional<ExecutionProgress> cached = progressCache.get(entity.getId().toString());
        if (cached.isPresent()) {
            return cached.get();
        }
        return ExecutionProgress.from(get(tenant, executionId), clock.instant());
    }
    
    @Transactional(readOnly = true)
    public List<ExecutionLogEntity> logs(TenantContext tenant, String executionId, Integer limit) {
        WorkflowExecutionEntity entity = findEntity(tenant, executionId);
        return logService.recent(entity.getId(), limit);
    }
    
    @Transactional(readOnly = true)
    public WorkflowExecutionEntity findEntity(TenantContext tenant, String executionId) {
        UUID id = Ids.parse(executionId).orElseThrow(() -> new ExecutionNotFoundException(executionId));
        WorkflowExecutionEntity entity = executionRepository.findByIdAndTenantId(id, tenant.getTenantId())
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
        if (tenant.getTeamId() != null && entity.getTeamId() != null && !tenant.getTeamId().equals(entity.getTeamId())) {
            throw new ExecutionNotFoundException(executionId);
        }
        return entity;
    }
    
    static ExecutionSnapshot toSnapshot(WorkflowExecutionEntity entity) {
        Map<SourceKey, SourceCounters> sources = new EnumMap<>(SourceKey.class);
        if (entity.getSources() != null) {
            entity.getSources().forEach((key, counters) -> sources.put(key, counters.copy()));
        }
        return ExecutionSnapshot.builder()
                .executionId(entity.getId().toString())
                .workflowId(entity.getWorkflowId().toString())
                .tenantId(entity.getTenantId())
                .teamId(entity.getTeamId())
                .status(entity.getStatus())
                .triggerType(entity.getTriggerType())
                .since(entity.getSince())
                .until(entity.getUntil())
                .totalDays(entity.getTotalDays())
                .daysProcessed(entity.getDaysProcessed())
                .currentDate(entity.getCurrentDate())
                .sources(Collections.unmodifiableMap(sources))
                .errors(entity.getErrors() == null ? List.of() : List.copyOf(entity.getErrors()))
                .createdAt(entity.getCreatedAt())
                .startedAt(entity.getStartedAt())
                .completedAt(entity.getCompletedAt())
                .stateInconsistent(entity.isStateInconsistent())
                .build();
    }
}
