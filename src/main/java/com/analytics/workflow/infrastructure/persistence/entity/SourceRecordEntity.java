package com.analytics.workflow.infrastructure.persistence.entity;

import com.analytics.workflow.domain.model.SourceKey;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One ingested record from an external source.
 * 
 * (tenantId, source, externalId) is unique, so re-fetching a day or
 * redelivering a webhook updates the row instead of adding a second one.
 */
@Entity
@Table(name = "source_records",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_source_record", columnNames = {"tenantId", "source", "externalId"})
    },
    indexes = {
        @Index(name = "idx_source_record_day", columnList = "tenantId,source,recordDate")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceRecordEntity {
    
    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;
    
    @Column(nullable = false, length = 64)
    private String tenantId;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SourceKey source;
    
    @Column(nullable = false, length = 200)
    private String externalId;
    
    @Column
    private LocalDate recordDate;
    
    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;
    
    @Column(columnDefinition = "UUID")
    private UUID lastExecutionId;
    
    @Column(nullable = false)
    private Instant createdAt;
    
    @Column(nullable = false)
    private Instant updatedAt;
    
    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }
    
    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
