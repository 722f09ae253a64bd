package com.analytics.workflow.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Inbound webhook payload plus its delivery state.
 * 
 * payload is the raw JSON body as received. attemptCount only grows;
 * nextAttemptAt is set while the item waits for a retry.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookQueueItem {
    
    private String id;
    private String tenantId;
    private String payload;
    private Instant receivedAt;
    private int attemptCount;
    private WebhookItemStatus status;
    private String lastError;
    private Instant nextAttemptAt;
    private Instant completedAt;
    private boolean inlineProcessed;
}
