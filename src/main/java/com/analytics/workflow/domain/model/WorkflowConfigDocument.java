package com.analytics.workflow.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stored JSON shape of a workflow config.
 * 
 * Example:
 * {
 *   "sources": {
 *     "ads": {"enabled": true, "minDelayMs": 500},
 *     "pos": {"enabled": true, "dateRange": {"type": "rolling", "offsetDays": 0}}
 *   },
 *   "dateRange": {"type": "relative", "days": 7},
 *   "rateLimit": {"adsDelayMs": 500, "posDelayMs": 250}
 * }
 * 
 * Loosely typed on purpose; WorkflowConfigParser turns it into a
 * validated {@link WorkflowConfig}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowConfigDocument {
    
    private Sources sources;
    private DateRangeSpec dateRange;
    private RateLimit rateLimit;
    
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Sources {
        private SourceSettings ads;
        private SourceSettings pos;
    }
    
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SourceSettings {
        private Boolean enabled;
        private DateRangeSpec dateRange;
        private Long minDelayMs;
    }
    
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RateLimit {
        private Long adsDelayMs;
        private Long posDelayMs;
    }
}
