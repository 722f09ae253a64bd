package com.analytics.workflow.domain.webhook;

import com.analytics.workflow.domain.model.WebhookQueueItem;

/**
 * Consumer of queued webhook items.
 * 
 * Delivery is at-least-once, so handle must be idempotent. Any exception
 * counts as a failed attempt.
 */
public interface WebhookHandler {
    
    void handle(WebhookQueueItem item) throws Exception;
}
