package com.analytics.workflow.infrastructure.persistence.repository;

import com.analytics.workflow.domain.model.ExecutionStatus;
import com.analytics.workflow.infrastructure.persistence.entity.WorkflowExecutionEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WorkflowExecutionRepository extends JpaRepository<WorkflowExecutionEntity, UUID> {
    
    List<WorkflowExecutionEntity> findByWorkflowIdAndTenantIdOrderByCreatedAtDesc(
            UUID workflowId, String tenantId, Pageable pageable);
    
    Optional<WorkflowExecutionEntity> findByIdAndTenantId(UUID id, String tenantId);
    
    boolean existsByWorkflowIdAndStatusIn(UUID workflowId, Collection<ExecutionStatus> statuses);
    
    /**
     * PENDING/RUNNING rows not touched since the cutoff; orphan candidates.
     */
    List<WorkflowExecutionEntity> findByStatusInAndUpdatedAtBefore(
            Collection<ExecutionStatus> statuses, Instant cutoff);
}
