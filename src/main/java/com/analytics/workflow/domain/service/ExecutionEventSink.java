package com.analytics.workflow.domain.service;

import com.analytics.workflow.domain.model.ExecutionEvent;

/**
 * Process-wide consumer of every published event (execution log, metrics).
 * 
 * Unlike a subscription, a sink is never dropped; its failures are logged.
 */
public interface ExecutionEventSink {
    
    void accept(ExecutionEvent event);
}
