package com.analytics.workflow.domain.exception;

public class WorkflowNotFoundException extends WorkflowEngineException {
    
    public WorkflowNotFoundException(String workflowId) {
        super("WORKFLOW_NOT_FOUND", "Workflow not found: " + workflowId);
    }
}
