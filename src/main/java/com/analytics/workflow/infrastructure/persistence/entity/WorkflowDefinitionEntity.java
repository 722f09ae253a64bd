package com.analytics.workflow.infrastructure.persistence.entity;

import com.analytics.workflow.infrastructure.persistence.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Stored workflow definition.
 * 
 * config holds the raw JSON as submitted; it is validated on write and
 * parsed again at the start of every run.
 */
@Entity
@Table(name = "workflow_definitions", indexes = {
    @Index(name = "idx_workflow_tenant", columnList = "tenantId,createdAt"),
    @Index(name = "idx_workflow_enabled", columnList = "enabled")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowDefinitionEntity {
    
    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;
    
    @Column(nullable = false, length = 64)
    private String tenantId;
    
    @Column(length = 64)
    private String teamId;
    
    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<String> sharedTeamIds = new ArrayList<>();
    
    @Column(nullable = false, length = 200)
    private String name;
    
    @Column(length = 1000)
    private String description;
    
    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;
    
    @Column(length = 120)
    private String schedule;
    
    @Column(nullable = false, columnDefinition = "TEXT")
    private String config;
    
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
    
    public boolean hasSchedule() {
        return schedule != null && !schedule.isBlank();
    }
    
    /**
     * Tenant-wide callers (no team) see everything; a team sees its own,
     * shared and unowned workflows.
     */
    public boolean isVisibleTo(String requestTeamId) {
        if (requestTeamId == null || teamId == null) {
            return true;
        }
        return requestTeamId.equals(teamId)
                || (sharedTeamIds != null && sharedTeamIds.contains(requestTeamId));
    }
}
