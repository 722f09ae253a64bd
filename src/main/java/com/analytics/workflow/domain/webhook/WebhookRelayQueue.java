package com.analytics.workflow.domain.webhook;

import com.analytics.workflow.config.WebhookQueueProperties;
import com.analytics.workflow.domain.exception.QueueBackendUnavailableException;
import com.analytics.workflow.domain.exception.ValidationException;
import com.analytics.workflow.domain.model.QueueStatusView;
import com.analytics.workflow.domain.model.WebhookItemStatus;
import com.analytics.workflow.domain.model.WebhookQueueItem;
import com.analytics.workflow.domain.model.WebhookReceipt;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point of inbound webhooks.
 * 
 * Processing modes:
 * - inline-processing=true: handled synchronously, never queued
 * - default: stored in the backend and handled later by the worker
 * - backend unreachable and inline-fallback=true: handled synchronously
 *   and marked inlineProcessed; the item is never also queued
 * - backend unreachable without fallback: QueueBackendUnavailableException
 * 
 * An inline run is a single attempt; its failure is logged, counted and
 * reported in the receipt.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookRelayQueue {
    
    private static final int FAILED_ITEMS_IN_STATUS = 50;
    
    private final WebhookQueueBackend backend;
    private final WebhookDispatcher dispatcher;
    private final WebhookQueueProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    
    private final AtomicLong inlineProcessed = new AtomicLong();
    private final AtomicLong inlineFailed = new AtomicLong();
    
    public WebhookReceipt enqueue(String tenantId, String payload) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("tenantId is required");
        }
        if (payload == null || payload.isBlank()) {
            throw new ValidationException("Webhook payload is empty");
        }
        
        WebhookQueueItem item = WebhookQueueItem.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(tenantId)
                .payload(payload)
                .receivedAt(clock.instant())
                .attemptCount(0)
                .status(WebhookItemStatus.QUEUED)
                .build();
        
        if (properties.isInlineProcessing()) {
            return processInline(item, WebhookReceipt.MODE_INLINE);
        }
        
        try {
            backend.schedule(item, item.getReceivedAt());
        } catch (QueueBackendUnavailableException e) {
            if (!properties.isInlineFallback()) {
                log.error("Webhook queue unavailable and inline fallback disabled, rejecting item for tenant {}: {}",
                        tenantId, e.getMessage(), e);
                throw e;
            }
            log.warn("Webhook queue unavailable, processing item {} inline: {}", item.getId(), e.getMessage());
            return processInline(item, WebhookReceipt.MODE_INLINE_FALLBACK);
        }
        
        Counter.builder("webhook.queue.enqueued")
                .register(meterRegistry)
                .increment();
        log.debug("Webhook item {} queued for tenant {}", item.getId(), tenantId);
        
        return WebhookReceipt.builder()
                .itemId(item.getId())
                .tenantId(tenantId)
                .queued(true)
                .processingMode(WebhookReceipt.MODE_QUEUED)
                .status(WebhookItemStatus.QUEUED)
                .build();
    }
    
    public QueueStatusView status() {
        QueueStatusView.QueueStatusViewBuilder view = QueueStatusView.builder()
                .backend(backend.name())
                .inlineProcessed(inlineProcessed.get())
                .inlineFailed(inlineFailed.get());
        try {
            view.queued(backend.queuedCount())
                    .inFlight(backend.inFlightCount())
                    .completed(backend.completedCount())
                    .failed(backend.failedCount())
                    .failedItems(backend.failedItems(FAILED_ITEMS_IN_STATUS))
                    .available(true);
        } catch (QueueBackendUnavailableException e) {
            log.warn("Webhook queue status unavailable: {}", e.getMessage());
            view.available(false).failedItems(List.of());
        }
        return view.build();
    }
    
    public long getInlineProcessedCount() {
        return inlineProcessed.get();
    }
    
    public long getInlineFailedCount() {
        return inlineFailed.get();
    }
    
    private WebhookReceipt processInline(WebhookQueueItem item, String mode) {
        item.setInlineProcessed(true);
        item.setAttemptCount(1);
        item.setStatus(WebhookItemStatus.PROCESSING);
        
        String error = null;
        try {
            dispatcher.dispatch(item);
            item.setStatus(WebhookItemStatus.INLINE_COMPLETED);
            inlineProcessed.incrementAndGet();
        } catch (Exception e) {
            error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            item.setStatus(WebhookItemStatus.INLINE_FAILED);
            item.setLastError(error);
            inlineFailed.incrementAndGet();
            log.error("Inline webhook item {} (tenant {}) failed: {}", item.getId(), item.getTenantId(), error, e);
        }
        item.setCompletedAt(clock.instant());
        
        Counter.builder("webhook.queue.inline")
                .tag("mode", mode)
                .tag("outcome", error == null ? "success" : "failure")
                .register(meterRegistry)
                .increment();
        
        return WebhookReceipt.builder()
                .itemId(item.getId())
                .tenantId(item.getTenantId())
                .queued(false)
                .processingMode(mode)
                .status(item.getStatus())
                .error(error)
                .build();
    }
}
