package com.analytics.workflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Last-known progress of an execution as kept in the progress cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionProgress {
    
    private String executionId;
    private String workflowId;
    private String tenantId;
    private ExecutionStatus status;
    private String statusLabel;
    private int totalDays;
    private int daysProcessed;
    private int percent;
    private String currentDate;
    private int errorCount;
    private Map<SourceKey, SourceCounters> sources;
    private Instant updatedAt;
    
    public static ExecutionProgress from(ExecutionSnapshot snapshot, Instant updatedAt) {
        int errorCount = snapshot.getErrors() == null ? 0 : snapshot.getErrors().size();
        int percent = snapshot.getTotalDays() == 0
                ? 0
                : (int) Math.floor(snapshot.getDaysProcessed() * 100.0 / snapshot.getTotalDays());
        
        Map<SourceKey, SourceCounters> sources = new EnumMap<>(SourceKey.class);
        if (snapshot.getSources() != null) {
            snapshot.getSources().forEach((key, counters) -> sources.put(key, counters.copy()));
        }
        
        return ExecutionProgress.builder()
                .executionId(snapshot.getExecutionId())
                .workflowId(snapshot.getWorkflowId())
                .tenantId(snapshot.getTenantId())
                .status(snapshot.getStatus())
                .statusLabel(snapshot.getStatusLabel())
                .totalDays(snapshot.getTotalDays())
                .daysProcessed(snapshot.getDaysProcessed())
                .percent(percent)
                .currentDate(snapshot.getCurrentDate() == null ? null : snapshot.getCurrentDate().toString())
                .errorCount(errorCount)
                .sources(sources)
                .updatedAt(updatedAt)
                .build();
    }
}
