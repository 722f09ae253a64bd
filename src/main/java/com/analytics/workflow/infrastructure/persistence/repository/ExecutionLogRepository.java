package com.analytics.workflow.infrastructure.persistence.repository;

import com.analytics.workflow.infrastructure.persistence.entity.ExecutionLogEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ExecutionLogRepository extends JpaRepository<ExecutionLogEntity, Long> {
    
    List<ExecutionLogEntity> findByExecutionIdOrderByIdDesc(UUID executionId, Pageable pageable);
}
