package com.analytics.workflow.domain.exception;

/**
 * Webhook queue backend cannot be reached.
 */
public class QueueBackendUnavailableException extends WorkflowEngineException {
    
    public QueueBackendUnavailableException(String message, Throwable cause) {
        super("QUEUE_UNAVAILABLE", message, cause);
    }
}
