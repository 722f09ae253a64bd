package com.analytics.workflow.domain.webhook;

import com.analytics.workflow.config.WebhookQueueProperties;
import com.analytics.workflow.domain.exception.QueueBackendUnavailableException;
import com.analytics.workflow.domain.model.WebhookItemStatus;
import com.analytics.workflow.domain.model.WebhookQueueItem;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

/**
 * Relay worker draining the webhook queue.
 * 
 * Per pump:
 * 1. Claim (lease) up to batch-size due items
 * 2. attemptCount++, run the handler with the per-item timeout
 * 3. Success: completed bucket (no further attempts)
 * 4. Failure or timeout: back into the ready set after backoff(attempt)
 *    while attempt < max-attempts, otherwise the failed bucket, where it
 *    is never retried
 * 
 * Buckets are trimmed to keep-completed / keep-failed entries.
 * 
 * If the outcome of an item cannot be recorded, the item keeps its lease
 * and is delivered again once the lease runs out; the rest of the batch
 * is still processed. If the handler pool rejects an item, that item and
 * the rest of the batch go back to the ready set without using up an
 * attempt.
 */
@Slf4j
@Component
public class WebhookQueueWorker {
    
    private final WebhookQueueBackend backend;
    private final WebhookDispatcher dispatcher;
    private final WebhookQueueProperties properties;
    private final BackoffCalculator backoffCalculator;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    
    @Autowired
    public WebhookQueueWorker(WebhookQueueBackend backend,
                              WebhookDispatcher dispatcher,
                              WebhookQueueProperties properties,
                              MeterRegistry meterRegistry,
                              Clock clock) {
        this(backend, dispatcher, properties,
                new BackoffCalculator(
                        properties.getBackoffDelayMs(),
                        Math.max(properties.getBackoffDelayMs(), properties.getMaxBackoffDelayMs()),
                        properties.getJitterFactor()),
                meterRegistry, clock);
    }
    
    public WebhookQueueWorker(WebhookQueueBackend backend,
                              WebhookDispatcher dispatcher,
                              WebhookQueueProperties properties,
                              BackoffCalculator backoffCalculator,
                              MeterRegistry meterRegistry,
                              Clock clock) {
        this.backend = backend;
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.backoffCalculator = backoffCalculator;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }
    
    @Scheduled(fixedDelayString = "${webhook-queue.poll-interval-ms:1000}")
    public void scheduledPump() {
        if (properties.isInlineProcessing()) {
            return;
        }
        try {
            pump();
        } catch (QueueBackendUnavailableException e) {
            log.warn("Webhook queue unavailable, skipping pump: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Webhook queue pump failed: {}", e.getMessage(), e);
        }
    }
    
    /**
     * @return number of items attempted
     */
    public int pump() {
        Instant now = clock.instant();
        List<WebhookQueueItem> due = backend.claimDue(now, properties.getBatchSize(), now.plusMillis(leaseMs()));
        if (due.isEmpty()) {
            return 0;
        }
        log.debug("Processing {} webhook items", due.size());
        
        int attempted = 0;
        for (int i = 0; i < due.size(); i++) {
            WebhookQueueItem item = due.get(i);
            try {
                process(item);
                attempted++;
            } catch (RejectedExecutionException e) {
                log.warn("Webhook handler pool is saturated, returning {} items to the queue: {}",
                        due.size() - i, e.getMessage());
                release(due.subList(i, due.size()));
                break;
            } catch (QueueBackendUnavailableException e) {
                attempted++;
                Counter.builder("webhook.queue.unrecorded")
                        .register(meterRegistry)
                        .increment();
                log.warn("Outcome of webhook item {} not recorded, redelivered after its lease: {}",
                        item.getId(), e.getMessage());
            }
        }
        return attempted;
    }
    
    /**
     * @throws RejectedExecutionException when the handler pool has no room;
     *         the item is left as claimed, with no attempt used
     */
    void process(WebhookQueueItem item) {
        int attempt = item.getAttemptCount() + 1;
        item.setAttemptCount(attempt);
        item.setStatus(WebhookItemStatus.PROCESSING);
        item.setNextAttemptAt(null);
        
        try {
            dispatcher.dispatch(item);
        } catch (RejectedExecutionException e) {
            item.setAttemptCount(attempt - 1);
            item.setStatus(WebhookItemStatus.QUEUED);
            throw e;
        } catch (Exception e) {
            handleFailure(item, attempt, e);
            return;
        }
        
        item.setStatus(WebhookItemStatus.COMPLETED);
        item.setCompletedAt(clock.instant());
        backend.complete(item, properties.getKeepCompleted());
        
        Counter.builder("webhook.queue.completed")
                .register(meterRegistry)
                .increment();
        log.debug("Webhook item {} completed on attempt {}", item.getId(), attempt);
    }
    
    private void release(List<WebhookQueueItem> items) {
        Instant now = clock.instant();
        for (WebhookQueueItem item : items) {
            try {
                backend.schedule(item, now);
            } catch (QueueBackendUnavailableException e) {
                log.warn("Could not release webhook item {}, redelivered after its lease: {}",
                        item.getId(), e.getMessage());
            }
        }
    }
    
    private long leaseMs() {
        long batchBudgetMs = (long) properties.getBatchSize() * properties.getTimeoutMs();
        return Math.max(properties.getLeaseMs(), batchBudgetMs);
    }
    
    private void handleFailure(WebhookQueueItem item, int attempt, Exception e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        item.setLastError(message);
        
        if (attempt < properties.getMaxAttempts()) {
            long delayMs = backoffCalculator.calculate(attempt);
            Instant nextAttemptAt = clock.instant().plusMillis(delayMs);
            item.setStatus(WebhookItemStatus.QUEUED);
            item.setNextAttemptAt(nextAttemptAt);
            backend.schedule(item, nextAttemptAt);
            
            Counter.builder("webhook.queue.retried")
                    .register(meterRegistry)
                    .increment();
            log.warn("Webhook item {} failed attempt {}/{}, retrying in {} ms: {}",
                    item.getId(), attempt, properties.getMaxAttempts(), delayMs, message);
            return;
        }
        
        item.setStatus(WebhookItemStatus.FAILED);
        item.setCompletedAt(clock.instant());
        backend.fail(item, properties.getKeepFailed());
        
        Counter.builder("webhook.queue.failed")
                .register(meterRegistry)
                .increment();
        log.error("Webhook item {} (tenant {}) failed permanently after {} attempts: {}",
                item.getId(), item.getTenantId(), attempt, message, e);
    }
}
