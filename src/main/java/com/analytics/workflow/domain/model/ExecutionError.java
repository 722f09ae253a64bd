package com.analytics.workflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One recorded failure of an execution.
 * 
 * day is "N/A" and source is "system" for run-level failures.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionError {
    
    public static final String NO_DAY = "N/A";
    public static final String SYSTEM_SOURCE = "system";
    
    private String day;
    private String source;
    private String message;
    private Instant timestamp;
    
    public static ExecutionError system(String message, Instant timestamp) {
        return new ExecutionError(NO_DAY, SYSTEM_SOURCE, message, timestamp);
    }
}
