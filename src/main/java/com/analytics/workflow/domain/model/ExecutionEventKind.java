package com.analytics.workflow.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event names pushed to live subscribers.
 */
public enum ExecutionEventKind {
    
    SNAPSHOT("execution:snapshot"),
    STARTED("execution:started"),
    DATE_STARTED("execution:date_started"),
    PROGRESS("execution:progress"),
    ERROR("execution:error"),
    DAY_COMPLETED("execution:day_completed"),
    COMPLETED("execution:completed"),
    COMPLETED_WITH_ERRORS("execution:completed_with_errors"),
    FAILED("execution:failed"),
    CANCELLED("execution:cancelled");
    
    private final String wireName;
    
    ExecutionEventKind(String wireName) {
        this.wireName = wireName;
    }
    
    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
