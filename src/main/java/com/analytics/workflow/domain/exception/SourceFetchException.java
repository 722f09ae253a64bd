package com.analytics.workflow.domain.exception;

import com.analytics.workflow.domain.model.SourceKey;

import java.time.LocalDate;

/**
 * A source could not deliver records for one day. Recorded against that
 * day; the run continues.
 */
public class SourceFetchException extends WorkflowEngineException {
    
    public SourceFetchException(SourceKey source, LocalDate day, String message, Throwable cause) {
        super("SOURCE_FETCH_FAILED", source + " fetch failed for " + day + ": " + message, cause);
    }
}
