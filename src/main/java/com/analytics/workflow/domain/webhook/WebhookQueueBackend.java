package com.analytics.workflow.domain.webhook;

import com.analytics.workflow.domain.model.WebhookQueueItem;

import java.time.Instant;
import java.util.List;

/**
 * Storage of the webhook relay queue: a ready set ordered by due time,
 * an in-flight set of leased items, plus bounded completed and failed
 * buckets.
 * 
 * A claimed item stays leased until it is completed, failed or scheduled
 * again. A lease that runs out puts the item back in the ready set, so an
 * item whose outcome was never recorded is delivered again.
 * 
 * Every operation throws
 * {@link com.analytics.workflow.domain.exception.QueueBackendUnavailableException}
 * when the store cannot be reached.
 */
public interface WebhookQueueBackend {
    
    String name();
    
    /**
     * Adds the item to the ready set, due at availableAt, releasing any
     * lease on it.
     */
    void schedule(WebhookQueueItem item, Instant availableAt);
    
    /**
     * Returns expired leases to the ready set, then moves up to max items
     * due at or before now into the in-flight set, leased until leaseUntil.
     * Oldest due first.
     */
    List<WebhookQueueItem> claimDue(Instant now, int max, Instant leaseUntil);
    
    /**
     * Records the item in the completed bucket, trimmed to keep entries.
     */
    void complete(WebhookQueueItem item, int keep);
    
    /**
     * Records the item in the failed bucket, trimmed to keep entries.
     */
    void fail(WebhookQueueItem item, int keep);
    
    long queuedCount();
    
    long inFlightCount();
    
    long completedCount();
    
    long failedCount();
    
    /**
     * Most recent failed items first.
     */
    List<WebhookQueueItem> failedItems(int limit);
}
