package com.analytics.workflow.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only log line of an execution, one per published event.
 */
@Entity
@Table(name = "execution_logs", indexes = {
    @Index(name = "idx_execution_log", columnList = "executionId,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionLogEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false, columnDefinition = "UUID")
    private UUID executionId;
    
    @Column(nullable = false, length = 64)
    private String tenantId;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private LogLevel level;
    
    @Column(nullable = false, length = 60)
    private String event;
    
    @Column(nullable = false, length = 2000)
    private String message;
    
    @Column(nullable = false)
    private Instant createdAt;
    
    public enum LogLevel {
        INFO,
        WARN,
        ERROR
    }
    
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
