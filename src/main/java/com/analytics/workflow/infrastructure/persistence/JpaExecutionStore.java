package com.analytics.workflow.infrastructure.persistence;

import com.analytics.workflow.domain.model.ExecutionSnapshot;
import com.analytics.workflow.domain.model.SourceKey;
import com.analytics.workflow.domain.service.ExecutionStore;
import com.analytics.workflow.infrastructure.persistence.entity.WorkflowExecutionEntity;
import com.analytics.workflow.infrastructure.persistence.repository.WorkflowExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.UUID;

/**
 * Writes execution snapshots to the workflow_executions table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaExecutionStore implements ExecutionStore {
    
    private final WorkflowExecutionRepository executionRepository;
    
    @Override
    @Transactional
    public void persist(ExecutionSnapshot snapshot) {
        UUID id = UUID.fromString(snapshot.getExecutionId());
        
        WorkflowExecutionEntity entity = executionRepository.findById(id)
                .orElseGet(() -> WorkflowExecutionEntity.builder()
                        .id(id)
                        .createdAt(snapshot.getCreatedAt())
                        .build());
        
        entity.setWorkflowId(UUID.fromString(snapshot.getWorkflowId()));
        entity.setTenantId(snapshot.getTenantId());
        entity.setTeamId(snapshot.getTeamId());
        entity.setStatus(snapshot.getStatus());
        entity.setTriggerType(snapshot.getTriggerType());
        entity.setSince(snapshot.getSince());
        entity.setUntil(snapshot.getUntil());
        entity.setTotalDays(snapshot.getTotalDays());
        entity.setDaysProcessed(snapshot.getDaysProcessed());
        entity.setCurrentDate(snapshot.getCurrentDate());
        entity.setSources(snapshot.getSources() == null || snapshot.getSources().isEmpty()
                ? new EnumMap<>(SourceKey.class)
                : new EnumMap<>(snapshot.getSources()));
        entity.setErrors(new ArrayList<>(snapshot.getErrors()));
        entity.setStartedAt(snapshot.getStartedAt());
        entity.setCompletedAt(snapshot.getCompletedAt());
        entity.setDurationMs(snapshot.getDurationMs());
        entity.setStateInconsistent(snapshot.isStateInconsistent());
        
        executionRepository.save(entity);
        log.debug("Stored execution {} ({}, {}/{} days)",
                snapshot.getExecutionId(), snapshot.getStatus(),
                snapshot.getDaysProcessed(), snapshot.getTotalDays());
    }
}
