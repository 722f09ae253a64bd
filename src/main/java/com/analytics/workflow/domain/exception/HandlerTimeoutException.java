package com.analytics.workflow.domain.exception;

/**
 * A webhook handler call ran past the per-item timeout. Treated like any
 * other handler failure by the retry policy.
 */
public class HandlerTimeoutException extends WorkflowEngineException {
    
    public HandlerTimeoutException(String itemId, long timeoutMs) {
        super("HANDLER_TIMEOUT", "Webhook item " + itemId + " timed out after " + timeoutMs + "ms");
    }
}
