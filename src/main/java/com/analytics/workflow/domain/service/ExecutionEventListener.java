package com.analytics.workflow.domain.service;

import com.analytics.workflow.domain.model.ExecutionEvent;

/**
 * Receiver of one subscription's events. Throwing drops the subscription.
 */
@FunctionalInterface
public interface ExecutionEventListener {
    
    void onEvent(ExecutionEvent event) throws Exception;
}
