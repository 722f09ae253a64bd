package com.analytics.workflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Operational view of the webhook relay queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatusView {
    
    private String backend;
    private boolean available;
    private long queued;
    private long inFlight;
    private long completed;
    private long failed;
    private long inlineProcessed;
    private long inlineFailed;
    private List<WebhookQueueItem> failedItems;
}
