package com.analytics.workflow.domain.model;

public enum WebhookItemStatus {
    
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    INLINE_COMPLETED,
    INLINE_FAILED;
    
    public boolean isTerminal() {
        return this != QUEUED && this != PROCESSING;
    }
}
