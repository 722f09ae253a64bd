package com.analytics.workflow.domain.service;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executions owned by this process, keyed by execution id.
 * 
 * Holds the live tracker and the cooperative cancel flag of each run.
 */
@Component
public class ExecutionRegistry {
    
    private final ConcurrentMap<String, ActiveExecution> active = new ConcurrentHashMap<>();
    
    public ActiveExecution register(ExecutionTracker tracker) {
        ActiveExecution execution = new ActiveExecution(tracker);
        ActiveExecution previous = active.putIfAbsent(tracker.getContext().getExecutionId(), execution);
        if (previous != null) {
            throw new IllegalStateException("Execution already registered: " + tracker.getContext().getExecutionId());
        }
        return execution;
    }
    
    public Optional<ActiveExecution> find(String executionId) {
        return Optional.ofNullable(active.get(executionId));
    }
    
    public void remove(String executionId) {
        active.remove(executionId);
    }
    
    /**
     * @return false when the execution is not owned by this process
     */
    public boolean requestCancel(String executionId) {
        ActiveExecution execution = active.get(executionId);
        if (execution == null) {
            return false;
        }
        execution.cancelRequested.set(true);
        return true;
    }
    
    public boolean isActive(String executionId) {
        return active.containsKey(executionId);
    }
    
    public Set<String> activeIds() {
        return Set.copyOf(active.keySet());
    }
    
    public static final class ActiveExecution {
        
        private final ExecutionTracker tracker;
        private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
        
        private ActiveExecution(ExecutionTracker tracker) {
            this.tracker = tracker;
        }
        
        public ExecutionTracker getTracker() {
            return tracker;
        }
        
        public boolean isCancelRequested() {
            return cancelRequested.get();
        }
    }
}
