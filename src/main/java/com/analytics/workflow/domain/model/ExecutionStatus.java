package com.analytics.workflow.domain.model;

/**
 * Stored lifecycle state of an execution.
 * 
 * Allowed transitions:
 * - PENDING -> RUNNING
 * - PENDING -> FAILED (range or config could not be resolved)
 * - PENDING -> CANCELLED (cancelled before the run picked it up)
 * - RUNNING -> COMPLETED | FAILED | CANCELLED
 * 
 * Terminal states never transition again. COMPLETED_WITH_ERRORS is not a
 * state; see {@link #labelFor(ExecutionStatus, int)}.
 */
public enum ExecutionStatus {
    
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;
    
    public static final String COMPLETED_WITH_ERRORS = "COMPLETED_WITH_ERRORS";
    
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
    
    public boolean canTransitionTo(ExecutionStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED || next == CANCELLED;
            case RUNNING -> next.isTerminal();
            default -> false;
        };
    }
    
    /**
     * Validates and returns the next state.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public ExecutionStatus transitionTo(ExecutionStatus next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException(
                    String.format("Invalid execution status transition: %s -> %s", this, next));
        }
        return next;
    }
    
    /**
     * Label surfaced to observers. A completed run with recorded per-day
     * errors reads COMPLETED_WITH_ERRORS.
     */
    public static String labelFor(ExecutionStatus status, int errorCount) {
        if (status == COMPLETED && errorCount > 0) {
            return COMPLETED_WITH_ERRORS;
        }
        return status.name();
    }
}
