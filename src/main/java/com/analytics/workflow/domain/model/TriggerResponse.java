package com.analytics.workflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TriggerResponse {
    
    private String executionId;
    private String workflowId;
    private ExecutionStatus status;
}
