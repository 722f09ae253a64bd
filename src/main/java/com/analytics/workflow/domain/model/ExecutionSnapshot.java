package com.analytics.workflow.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Immutable point-in-time view of an execution record.
 * 
 * Produced by the tracker after every mutation and handed to the store,
 * the status API and new live subscribers.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionSnapshot {
    
    String executionId;
    String workflowId;
    String tenantId;
    String teamId;
    ExecutionStatus status;
    TriggerType triggerType;
    LocalDate since;
    LocalDate until;
    int totalDays;
    int daysProcessed;
    LocalDate currentDate;
    Map<SourceKey, SourceCounters> sources;
    List<ExecutionError> errors;
    Instant createdAt;
    Instant startedAt;
    Instant completedAt;
    boolean stateInconsistent;
    
    @JsonProperty("statusLabel")
    public String getStatusLabel() {
        return ExecutionStatus.labelFor(status, errors == null ? 0 : errors.size());
    }
    
    @JsonProperty("durationMs")
    public Long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
