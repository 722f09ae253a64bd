package com.analytics.workflow.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Ephemeral lifecycle/progress event of an execution.
 * 
 * tenantId/teamId route the event to tenant-scope subscribers.
 */
@Value
@Builder
public class ExecutionEvent {
    
    String executionId;
    String tenantId;
    String teamId;
    Instant timestamp;
    ExecutionEventKind eventKind;
    Map<String, Object> payload;
}
