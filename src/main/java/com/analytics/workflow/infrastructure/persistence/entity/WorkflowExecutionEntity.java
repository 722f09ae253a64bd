package com.analytics.workflow.infrastructure.persistence.entity;

import com.analytics.workflow.domain.model.ExecutionError;
import com.analytics.workflow.domain.model.ExecutionStatus;
import com.analytics.workflow.domain.model.SourceCounters;
import com.analytics.workflow.domain.model.SourceKey;
import com.analytics.workflow.domain.model.TriggerType;
import com.analytics.workflow.infrastructure.persistence.converter.ExecutionErrorListConverter;
import com.analytics.workflow.infrastructure.persistence.converter.SourceCountersMapConverter;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Durable record of one workflow execution.
 * 
 * Written by the execution tracker after every mutation (upsert by id).
 * Per-source counters and the error list are JSON TEXT columns.
 */
@Entity
@Table(name = "workflow_executions", indexes = {
    @Index(name = "idx_execution_workflow", columnList = "workflowId,createdAt"),
    @Index(name = "idx_execution_tenant", columnList = "tenantId"),
    @Index(name = "idx_execution_status", columnList = "status,updatedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowExecutionEntity {
    
    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;
    
    @Column(nullable = false, columnDefinition = "UUID")
    private UUID workflowId;
    
    @Column(nullable = false, length = 64)
    private String tenantId;
    
    @Column(length = 64)
    private String teamId;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ExecutionStatus status = ExecutionStatus.PENDING;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TriggerType triggerType;
    
    @Column(name = "since_date")
    private LocalDate since;
    
    @Column(name = "until_date")
    private LocalDate until;
    
    @Column(nullable = false)
    private int totalDays;
    
    @Column(nullable = false)
    private int daysProcessed;
    
    @Column
    private LocalDate currentDate;
    
    @Convert(converter = SourceCountersMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<SourceKey, SourceCounters> sources = new EnumMap<>(SourceKey.class);
    
    @Convert(converter = ExecutionErrorListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<ExecutionError> errors = new ArrayList<>();
    
    @Column
    private Instant startedAt;
    
    @Column
    private Instant completedAt;
    
    @Column
    private Long durationMs;
    
    @Column(nullable = false)
    private boolean stateInconsistent;
    
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
    
    @JsonProperty("statusLabel")
    public String getStatusLabel() {
        return ExecutionStatus.labelFor(status, errors == null ? 0 : errors.size());
    }
}
