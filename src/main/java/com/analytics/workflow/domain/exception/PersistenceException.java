package com.analytics.workflow.domain.exception;

/**
 * Execution snapshot could not be written to the store.
 */
public class PersistenceException extends WorkflowEngineException {
    
    public PersistenceException(String message, Throwable cause) {
        super("PERSISTENCE_FAILED", message, cause);
    }
}
