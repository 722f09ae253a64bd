package com.analytics.workflow.domain.exception;

/**
 * Base of all engine failures.
 * 
 * errorCode is the stable code returned in API error bodies.
 */
public class WorkflowEngineException extends RuntimeException {
    
    private final String errorCode;
    
    public WorkflowEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public WorkflowEngineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
