package com.analytics.workflow.domain.service;

import com.analytics.workflow.domain.model.ExecutionContext;
import com.analytics.workflow.domain.model.SourceKey;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Pluggable adapter for one external data source.
 * 
 * fetch pulls the raw records of a single day; process stores them and
 * returns how many were applied. Both may throw; the orchestrator records
 * the failure against the (day, source) pair and moves on.
 */
public interface SourceFetcher {
    
    SourceKey source();
    
    List<Map<String, Object>> fetch(ExecutionContext context, LocalDate day);
    
    int process(ExecutionContext context, LocalDate day, List<Map<String, Object>> records);
}
