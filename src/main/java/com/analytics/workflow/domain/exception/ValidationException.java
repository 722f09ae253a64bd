package com.analytics.workflow.domain.exception;

/**
 * Malformed range spec, workflow config or request. Raised before any
 * execution work starts.
 */
public class ValidationException extends WorkflowEngineException {
    
    public static final String CODE = "VALIDATION_ERROR";
    
    public ValidationException(String message) {
        super(CODE, message);
    }
    
    public ValidationException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
