package com.analytics.workflow.domain.model;

import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional body of a manual trigger.
 * 
 * When both dates are given they replace every source's date range for
 * this run only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerRequest {
    
    @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "since must be YYYY-MM-DD")
    private String since;
    
    @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "until must be YYYY-MM-DD")
    private String until;
    
    public boolean hasOverride() {
        return since != null || until != null;
    }
}
