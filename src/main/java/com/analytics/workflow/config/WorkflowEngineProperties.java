package com.analytics.workflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Settings of the workflow execution engine.
 * 
 * Bound from "workflow-engine.*" in application.yml.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "workflow-engine")
public class WorkflowEngineProperties {
    
    public static final int DEFAULT_MAX_RANGE_DAYS = 3660;
    
    /** Operating timezone used to compute "today". */
    @NotBlank
    private String zone = "Asia/Manila";
    
    /** Whether relative{days} ends at today instead of yesterday. */
    private boolean relativeIncludesToday = false;
    
    /** Longest day list a date range may resolve to. */
    @Min(1)
    private int maxRangeDays = DEFAULT_MAX_RANGE_DAYS;
    
    /** Per-source delay used when a workflow config sets none. */
    @Min(0)
    private long defaultSourceDelayMs = 1000;
    
    private Persistence persistence = new Persistence();
    private Reconciler reconciler = new Reconciler();
    private Progress progress = new Progress();
    private Scheduler scheduler = new Scheduler();
    private Websocket websocket = new Websocket();
    
    @Data
    public static class Persistence {
        @Min(1)
        private int maxAttempts = 3;
        @Min(0)
        private long retryDelayMs = 200;
    }
    
    @Data
    public static class Reconciler {
        private boolean enabled = true;
        @Min(1)
        private long staleMinutes = 30;
        @Min(1000)
        private long intervalMs = 300_000;
    }
    
    @Data
    public static class Progress {
        @Min(1)
        private long ttlSeconds = 86_400;
        private String keyPrefix = "workflow:progress";
    }
    
    @Data
    public static class Scheduler {
        private boolean enabled = true;
    }
    
    @Data
    public static class Websocket {
        private String[] allowedOrigins = {"*"};
    }
}
