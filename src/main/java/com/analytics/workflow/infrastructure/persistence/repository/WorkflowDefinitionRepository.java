package com.analytics.workflow.infrastructure.persistence.repository;

import com.analytics.workflow.infrastructure.persistence.entity.WorkflowDefinitionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WorkflowDefinitionRepository extends JpaRepository<WorkflowDefinitionEntity, UUID> {
    
    List<WorkflowDefinitionEntity> findByTenantIdOrderByCreatedAtDesc(String tenantId);
    
    Optional<WorkflowDefinitionEntity> findByIdAndTenantId(UUID id, String tenantId);
    
    List<WorkflowDefinitionEntity> findByEnabledTrueAndScheduleIsNotNull();
}
