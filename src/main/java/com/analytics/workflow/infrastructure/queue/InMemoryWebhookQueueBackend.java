package com.analytics.workflow.infrastructure.queue;

import com.analytics.workflow.domain.model.WebhookQueueItem;
import com.analytics.workflow.domain.webhook.WebhookQueueBackend;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Process-local webhook queue for local runs and tests.
 * 
 * Not durable: queued items are lost on restart.
 */
@Component
@ConditionalOnProperty(prefix = "webhook-queue", name = "backend", havingValue = "memory")
public class InMemoryWebhookQueueBackend implements WebhookQueueBackend {
    
    private final PriorityQueue<QueueEntry> ready = new PriorityQueue<>(
            Comparator.comparing(QueueEntry::availableAt).thenComparingLong(QueueEntry::sequence));
    private final Map<String, QueueEntry> inFlight = new LinkedHashMap<>();
    private final Deque<WebhookQueueItem> completed = new ArrayDeque<>();
    private final Deque<WebhookQueueItem> failed = new ArrayDeque<>();
    private long sequence;
    
    @Override
    public String name() {
        return "memory";
    }
    
    @Override
    public synchronized void schedule(WebhookQueueItem item, Instant availableAt) {
        inFlight.remove(item.getId());
        ready.add(new QueueEntry(item.toBuilder().build(), availableAt, sequence++));
    }
    
    @Override
    public synchronized List<WebhookQueueItem> claimDue(Instant now, int max, Instant leaseUntil) {
        Iterator<QueueEntry> leases = inFlight.values().iterator();
        while (leases.hasNext()) {
            QueueEntry lease = leases.next();
            if (!lease.availableAt().isAfter(now)) {
                leases.remove();
                ready.add(new QueueEntry(lease.item(), lease.availableAt(), sequence++));
            }
        }
        
        List<WebhookQueueItem> claimed = new ArrayList<>();
        while (claimed.size() < max && !ready.isEmpty() && !ready.peek().availableAt().isAfter(now)) {
            WebhookQueueItem item = ready.poll().item();
            inFlight.put(item.getId(), new QueueEntry(item, leaseUntil, sequence++));
            claimed.add(item.toBuilder().build());
        }
        return claimed;
    }
    
    @Override
    public synchronized void complete(WebhookQueueItem item, int keep) {
        inFlight.remove(item.getId());
        push(completed, item, keep);
    }
    
    @Override
    public synchronized void fail(WebhookQueueItem item, int keep) {
        inFlight.remove(item.getId());
        push(failed, item, keep);
    }
    
    @Override
    public synchronized long queuedCount() {
        return ready.size();
    }
    
    @Override
    public synchronized long inFlightCount() {
        return inFlight.size();
    }
    
    @Override
    public synchronized long completedCount() {
        return completed.size();
    }
    
    @Override
    public synchronized long failedCount() {
        return failed.size();
    }
    
    @Override
    public synchronized List<WebhookQueueItem> failedItems(int limit) {
        List<WebhookQueueItem> items = new ArrayList<>();
        Iterator<WebhookQueueItem> iterator = failed.iterator();
        while (iterator.hasNext() && items.size() < limit) {
            items.add(iterator.next().toBuilder().build());
        }
        return items;
    }
    
    public synchronized List<WebhookQueueItem> completedItems() {
        List<WebhookQueueItem> items = new ArrayList<>();
        completed.forEach(item -> items.add(item.toBuilder().build()));
        return items;
    }
    
    private static void push(Deque<WebhookQueueItem> bucket, WebhookQueueItem item, int keep) {
        bucket.addFirst(item.toBuilder().build());
        while (bucket.size() > Math.max(1, keep)) {
            bucket.removeLast();
        }
    }
    
    private static final class QueueEntry {
        
        private final WebhookQueueItem item;
        private final Instant availableAt;
        private final long sequence;
        
        private QueueEntry(WebhookQueueItem item, Instant availableAt, long sequence) {
            this.item = item;
            this.availableAt = availableAt;
            this.sequence = sequence;
        }
        
        WebhookQueueItem item() {
            return item;
        }
        
        Instant availableAt() {
            return availableAt;
        }
        
        long sequence() {
            return sequence;
        }
    }
}
