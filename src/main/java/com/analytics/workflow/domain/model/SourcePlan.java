package com.analytics.workflow.domain.model;

import lombok.Value;

/**
 * Validated per-source settings of one workflow.
 * 
 * dateRange is the effective range: the source override when present,
 * otherwise the workflow-level range.
 */
@Value
public class SourcePlan {
    
    SourceKey source;
    boolean enabled;
    DateRangeSpec dateRange;
    long minDelayMs;
}
