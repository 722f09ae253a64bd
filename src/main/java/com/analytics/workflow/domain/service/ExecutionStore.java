package com.analytics.workflow.domain.service;

import com.analytics.workflow.domain.model.ExecutionSnapshot;

/**
 * Durable sink for execution snapshots.
 * 
 * persist is an upsert keyed by execution id; implementations throw on
 * failure and leave retrying to the tracker.
 */
public interface ExecutionStore {
    
    void persist(ExecutionSnapshot snapshot);
}
