package com.analytics.workflow.domain.exception;

public class ExecutionNotFoundException extends WorkflowEngineException {
    
    public ExecutionNotFoundException(String executionId) {
        super("EXECUTION_NOT_FOUND", "Workflow execution not found: " + executionId);
    }
}
