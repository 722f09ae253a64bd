package com.analytics.workflow.domain.service;

import com.analytics.workflow.domain.model.ExecutionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fan-out of execution events to live subscribers.
 * 
 * Subscription scopes:
 * - execution: events of one execution id
 * - tenant: every execution of a tenant
 * - tenant + team: only executions carrying that team id
 * 
 * Each subscription owns an ordered queue drained on the event executor,
 * one drain at a time, so a subscriber sees events in emission order and
 * a slow subscriber never holds up the orchestrator or other subscribers.
 * A listener that throws is dropped.
 * 
 * A subscription can be opened paused: events queue up until resume().
 * The WebSocket endpoint uses this to send the current snapshot first and
 * only then release the live stream, so the client never misses an event
 * published between the snapshot and the subscription.
 */
@Slf4j
@Component
public class ExecutionEventPublisher {
    
    private final Executor eventExecutor;
    private final List<ExecutionEventSink> sinks;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    
    public ExecutionEventPublisher(@Qualifier("eventExecutor") Executor eventExecutor,
                                   List<ExecutionEventSink> sinks) {
        this.eventExecutor = eventExecutor;
        this.sinks = List.copyOf(sinks);
    }
    
    public void publish(ExecutionEvent event) {
        for (ExecutionEventSink sink : sinks) {
            try {
                sink.accept(event);
            } catch (RuntimeException e) {
                log.error("Event sink {} failed for {} of execution {}: {}",
                        sink.getClass().getSimpleName(), event.getEventKind(), event.getExecutionId(),
                        e.getMessage(), e);
            }
        }
        
        for (Subscription subscription : subscriptions) {
            if (subscription.matches(event)) {
                subscription.queue.add(event);
                scheduleDrain(subscription);
            }
        }
    }
    
    public Subscription subscribeExecution(String executionId, ExecutionEventListener listener, boolean paused) {
        Objects.requireNonNull(executionId, "executionId");
        return register(new Subscription(executionId, null, null, listener, paused));
    }
    
    public Subscription subscribeTenant(String tenantId, String teamId, ExecutionEventListener listener, boolean paused) {
        Objects.requireNonNull(tenantId, "tenantId");
        return register(new Subscription(null, tenantId, teamId, listener, paused));
    }
    
    /**
     * Releases a paused subscription; queued events are delivered in order.
     */
    public void resume(Subscription subscription) {
        subscription.paused = false;
        scheduleDrain(subscription);
    }
    
    public void unsubscribe(Subscription subscription) {
        subscription.closed = true;
        subscription.queue.clear();
        subscriptions.remove(subscription);
    }
    
    public int getSubscriptionCount() {
        return subscriptions.size();
    }
    
    private Subscription register(Subscription subscription) {
        subscriptions.add(subscription);
        log.debug("Opened subscription {} (execution={}, tenant={}, team={}, paused={})",
                subscription.id, subscription.executionId, subscription.tenantId,
                subscription.teamId, subscription.paused);
        return subscription;
    }
    
    private void scheduleDrain(Subscription subscription) {
        if (subscription.paused || subscription.closed || subscription.queue.isEmpty()) {
            return;
        }
        if (subscription.draining.compareAndSet(false, true)) {
            try {
                eventExecutor.execute(() -> drain(subscription));
            } catch (RejectedExecutionException e) {
                // Events stay queued; the next publish or resume schedules the drain again.
                subscription.draining.set(false);
                log.warn("Event pool saturated, deferring delivery to subscription {} ({} queued)",
                        subscription.id, subscription.queue.size());
            }
        }
    }
    
    private void drain(Subscription subscription) {
        try {
            while (!subscription.paused && !subscription.closed) {
                ExecutionEvent event = subscription.queue.poll();
                if (event == null) {
                    break;
                }
                try {
                    subscription.listener.onEvent(event);
                } catch (Exception e) {
                    log.warn("Dropping subscription {} after listener failure: {}",
                            subscription.id, e.getMessage());
                    unsubscribe(subscription);
                }
            }
        } finally {
            subscription.draining.set(false);
        }
        // An event may have been queued after the last poll but before the flag reset.
        scheduleDrain(subscription);
    }
    
    /**
     * Handle of one live subscription.
     */
    public static final class Subscription {
        
        private final String id = UUID.randomUUID().toString();
        private final String executionId;
        private final String tenantId;
        private final String teamId;
        private final ExecutionEventListener listener;
        private final Queue<ExecutionEvent> queue = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean(false);
        private volatile boolean paused;
        private volatile boolean closed;
        
        private Subscription(String executionId,
                             String tenantId,
                             String teamId,
                             ExecutionEventListener listener,
                             boolean paused) {
            this.executionId = executionId;
            this.tenantId = tenantId;
            this.teamId = teamId;
            this.listener = listener;
            this.paused = paused;
        }
        
        public String getId() {
            return id;
        }
        
        public boolean isClosed() {
            return closed;
        }
        
        private boolean matches(ExecutionEvent event) {
            if (closed) {
                return false;
            }
            if (executionId != null) {
                return executionId.equals(event.getExecutionId());
            }
            if (!tenantId.equals(event.getTenantId())) {
                return false;
            }
            return teamId == null || teamId.equals(event.getTeamId());
        }
    }
}
