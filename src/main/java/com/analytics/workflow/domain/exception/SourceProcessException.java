package com.analytics.workflow.domain.exception;

import com.analytics.workflow.domain.model.SourceKey;

import java.time.LocalDate;

/**
 * Fetched records of one day could not be processed.
 */
public class SourceProcessException extends WorkflowEngineException {
    
    public SourceProcessException(SourceKey source, LocalDate day, String message, Throwable cause) {
        super("SOURCE_PROCESS_FAILED", source + " processing failed for " + day + ": " + message, cause);
    }
}
