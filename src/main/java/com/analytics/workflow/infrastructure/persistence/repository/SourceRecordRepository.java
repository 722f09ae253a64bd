package com.analytics.workflow.infrastructure.persistence.repository;

import com.analytics.workflow.domain.model.SourceKey;
import com.analytics.workflow.infrastructure.persistence.entity.SourceRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SourceRecordRepository extends JpaRepository<SourceRecordEntity, UUID> {
    
    Optional<SourceRecordEntity> findByTenantIdAndSourceAndExternalId(
            String tenantId, SourceKey source, String externalId);
}
