package com.analytics.workflow.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Create/update body of a workflow definition.
 * 
 * schedule is a 5- or 6-field cron expression; null means manual only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowDefinitionRequest {
    
    @NotBlank
    @Size(max = 200)
    private String name;
    
    @Size(max = 1000)
    private String description;
    
    private Boolean enabled;
    
    private String teamId;
    
    private List<String> sharedTeamIds;
    
    @Size(max = 120)
    private String schedule;
    
    @NotNull
    private JsonNode config;
    
    public boolean isEnabledOrDefault() {
        return enabled == null || enabled;
    }
}
