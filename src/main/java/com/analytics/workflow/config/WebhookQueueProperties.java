package com.analytics.workflow.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the webhook relay queue, bound from "webhook-queue.*".
 * 
 * Bounds are enforced at startup; an out-of-range value fails the boot.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "webhook-queue")
public class WebhookQueueProperties {
    
    public static final String BACKEND_REDIS = "redis";
    public static final String BACKEND_MEMORY = "memory";
    
    /** Process every webhook synchronously and skip the queue. */
    private boolean inlineProcessing = false;
    
    /** Process synchronously when the backend cannot be reached. */
    private boolean inlineFallback = true;
    
    @Min(1)
    private int maxAttempts = 5;
    
    @Min(100)
    private long backoffDelayMs = 2000;
    
    @Min(100)
    private long maxBackoffDelayMs = 300_000;
    
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterFactor = 0.1;
    
    @Min(1000)
    private long timeoutMs = 30_000;
    
    @Min(1)
    private int keepCompleted = 100;
    
    @Min(1)
    private int keepFailed = 500;
    
    @Min(100)
    private long pollIntervalMs = 1000;
    
    @Min(1)
    private int batchSize = 10;
    
    /**
     * How long a claimed item stays leased before it is handed out again.
     * The worker never leases for less than batch-size x timeout-ms.
     */
    @Min(1000)
    private long leaseMs = 600_000;
    
    @NotBlank
    private String keyPrefix = "webhook:queue";
    
    /** "redis" or "memory". */
    @NotBlank
    private String backend = BACKEND_REDIS;
}
