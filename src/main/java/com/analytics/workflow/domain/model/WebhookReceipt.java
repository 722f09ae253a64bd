package com.analytics.workflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Returned to the webhook caller after enqueue.
 * 
 * queued=false means the item was handled inline (processingMode "inline"
 * or "inline-fallback"); error carries the handler failure of an inline run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookReceipt {
    
    public static final String MODE_QUEUED = "queued";
    public static final String MODE_INLINE = "inline";
    public static final String MODE_INLINE_FALLBACK = "inline-fallback";
    
    private String itemId;
    private String tenantId;
    private boolean queued;
    private String processingMode;
    private WebhookItemStatus status;
    private String error;
}
