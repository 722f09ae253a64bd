package com.analytics.workflow.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowDefinitionResponse {
    
    private String id;
    private String tenantId;
    private String teamId;
    private List<String> sharedTeamIds;
    private String name;
    private String description;
    private boolean enabled;
    private String schedule;
    private JsonNode config;
    private Instant createdAt;
    private Instant updatedAt;
}
