package com.analytics.workflow.domain.webhook;

import com.analytics.workflow.config.WebhookQueueProperties;
import com.analytics.workflow.domain.exception.QueueBackendUnavailableException;
import com.analytics.workflow.domain.model.WebhookItemStatus;
import com.analytics.workflow.domain.model.WebhookQueueItem;
import com.analytics.workflow.infrastructure.queue.InMemoryWebhookQueueBackend;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WebhookQueueWorker over the in-memory backend.
 * 
 * Time only moves when the test advances the clock; backoff has no jitter.
 */
class WebhookQueueWorkerTest {
    
    private static final Duration PAST_LEASE = Duration.ofMillis(600_001);
    
    private MutableClock clock;
    private WebhookQueueProperties properties;
    private FlakyBackend backend;
    private MeterRegistry meterRegistry;
    private AtomicInteger calls;
    
    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        properties = new WebhookQueueProperties();
        properties.setMaxAttempts(5);
        properties.setBackoffDelayMs(2000);
        backend = new FlakyBackend();
        meterRegistry = new SimpleMeterRegistry();
        calls = new AtomicInteger();
    }
    
    @Test
    void testPump_TransientFailuresThenSuccess() {
        // Given - fails attempts 1 and 2
        WebhookQueueWorker worker = worker(item -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("POS API 503");
            }
        });
        backend.schedule(item("item-1"), clock.instant());
        
        // When
        drain(worker, 10);
        
        // Then
        assertEquals(3, calls.get());
        assertEquals(1, backend.completedCount());
        assertEquals(0, backend.failedCount());
        assertEquals(0, backend.queuedCount());
        WebhookQueueItem completed = backend.completedItems().get(0);
        assertEquals(3, completed.getAttemptCount());
        assertEquals(WebhookItemStatus.COMPLETED, completed.getStatus());
    }
    
    @Test
    void testPump_ExhaustedItemLandsInFailedBucket() {
        // Given
        WebhookQueueWorker worker = worker(item -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bad payload");
        });
        backend.schedule(item("item-1"), clock.instant());
        
        // When
        drain(worker, 20);
        
        // Then
        assertEquals(5, calls.get());
        assertEquals(1, backend.failedCount());
        assertEquals(0, backend.queuedCount());
        WebhookQueueItem failed = backend.failedItems(10).get(0);
        assertEquals(WebhookItemStatus.FAILED, failed.getStatus());
        assertEquals(5, failed.getAttemptCount());
        assertEquals("bad payload", failed.getLastError());
        assertEquals(1.0, meterRegistry.get("webhook.queue.failed").counter().count());
    }
    
    @Test
    void testPump_RetryWaitsForBackoff() {
        // Given
        WebhookQueueWorker worker = worker(item -> {
            calls.incrementAndGet();
            throw new IllegalStateException("down");
        });
        backend.schedule(item("item-1"), clock.instant());
        
        // When
        worker.pump();
        int beforeDue = worker.pump();
        clock.advance(Duration.ofMillis(1999));
        int stillEarly = worker.pump();
        clock.advance(Duration.ofMillis(1));
        int due = worker.pump();
        
        // Then
        assertEquals(0, beforeDue);
        assertEquals(0, stillEarly);
        assertEquals(1, due);
        assertEquals(2, calls.get());
    }
    
    @Test
    void testPump_SingleAttemptConfig() {
        // Given
        properties.setMaxAttempts(1);
        WebhookQueueWorker worker = worker(item -> {
            calls.incrementAndGet();
            throw new IllegalStateException("down");
        });
        backend.schedule(item("item-1"), clock.instant());
        
        // When
        drain(worker, 5);
        
        // Then
        assertEquals(1, calls.get());
        assertEquals(1, backend.failedCount());
    }
    
    @Test
    void testPump_CompletedBucketIsTrimmed() {
        // Given
        properties.setKeepCompleted(2);
        WebhookQueueWorker worker = worker(item -> calls.incrementAndGet());
        for (int i = 1; i <= 3; i++) {
            backend.schedule(item("item-" + i), clock.instant());
        }
        
        // When
        int processed = worker.pump();
        
        // Then
        assertEquals(3, processed);
        assertEquals(2, backend.completedCount());
        List<WebhookQueueItem> kept = backend.completedItems();
        assertEquals("item-3", kept.get(0).getId());
        assertEquals("item-2", kept.get(1).getId());
    }
    
    @Test
    void testPump_BatchSizeLimitsClaim() {
        // Given
        properties.setBatchSize(2);
        WebhookQueueWorker worker = worker(item -> calls.incrementAndGet());
        for (int i = 1; i <= 5; i++) {
            backend.schedule(item("item-" + i), clock.instant());
        }
        
        // When
        int processed = worker.pump();
        
        // Then
        assertEquals(2, processed);
        assertEquals(3, backend.queuedCount());
    }
    
    @Test
    void testPump_TimeoutCountsAsFailedAttempt() {
        // Given
        properties.setTimeoutMs(100);
        ExecutorService handlerPool = Executors.newSingleThreadExecutor();
        try {
            WebhookHandler slow = item -> Thread.sleep(5_000);
            WebhookDispatcher dispatcher = new WebhookDispatcher(slow, handlerPool, properties);
            WebhookQueueWorker worker = new WebhookQueueWorker(backend, dispatcher, properties,
                    new BackoffCalculator(2000, 300_000, 0.0), meterRegistry, clock);
            backend.schedule(item("item-1"), clock.instant());
            
            // When
            worker.pump();
            
            // Then
            assertEquals(1, backend.queuedCount());
            assertEquals(0, backend.completedCount());
            assertEquals(1.0, meterRegistry.get("webhook.queue.retried").counter().count());
        } finally {
            handlerPool.shutdownNow();
        }
    }
    
    @Test
    void testPump_FailedRescheduleDoesNotStopBatchAndItemIsRedelivered() {
        // Given - "a" fails, then recording its retry hits a backend outage
        AtomicInteger callsForA = new AtomicInteger();
        WebhookQueueWorker worker = worker(item -> {
            calls.incrementAndGet();
            if (item.getId().equals("a")) {
                callsForA.incrementAndGet();
                throw new IllegalStateException("POS API 503");
            }
        });
        backend.schedule(item("a"), clock.instant());
        backend.schedule(item("b"), clock.instant());
        backend.failNextSchedule = true;
        
        // When
        int attempted = worker.pump();
        
        // Then - "b" still ran, "a" is held by its lease
        assertEquals(2, attempted);
        assertEquals(2, calls.get());
        assertEquals(1, backend.completedCount());
        assertEquals(0, backend.queuedCount());
        assertEquals(1, backend.inFlightCount());
        assertEquals(1.0, meterRegistry.get("webhook.queue.unrecorded").counter().count());
        
        // When - lease runs out
        assertEquals(0, worker.pump());
        clock.advance(PAST_LEASE);
        worker.pump();
        
        // Then
        assertEquals(2, callsForA.get());
        assertEquals(1, backend.queuedCount());
        assertEquals(0, backend.inFlightCount());
    }
    
    @Test
    void testPump_FailedCompleteRedeliversAfterLease() {
        // Given
        WebhookQueueWorker worker = worker(item -> calls.incrementAndGet());
        backend.schedule(item("item-1"), clock.instant());
        backend.failNextComplete = true;
        
        // When
        worker.pump();
        clock.advance(PAST_LEASE);
        worker.pump();
        
        // Then
        assertEquals(2, calls.get());
        assertEquals(1, backend.completedCount());
        assertEquals(0, backend.inFlightCount());
    }
    
    @Test
    void testPump_FailedMoveToFailedBucketRedeliversAfterLease() {
        // Given
        properties.setMaxAttempts(1);
        WebhookQueueWorker worker = worker(item -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bad payload");
        });
        backend.schedule(item("item-1"), clock.instant());
        backend.failNextFail = true;
        
        // When
        worker.pump();
        long inFlightAfterOutage = backend.inFlightCount();
        clock.advance(PAST_LEASE);
        worker.pump();
        
        // Then
        assertEquals(1, inFlightAfterOutage);
        assertEquals(2, calls.get());
        assertEquals(1, backend.failedCount());
    }
    
    @Test
    void testPump_RejectedHandlerReturnsBatchWithoutUsingAttempt() {
        // Given
        WebhookHandler handler = item -> calls.incrementAndGet();
        WebhookDispatcher dispatcher = new WebhookDispatcher(handler, task -> {
            throw new RejectedExecutionException("pool full");
        }, properties);
        WebhookQueueWorker worker = new WebhookQueueWorker(backend, dispatcher, properties,
                new BackoffCalculator(2000, 300_000, 0.0), meterRegistry, clock);
        backend.schedule(item("item-1"), clock.instant());
        backend.schedule(item("item-2"), clock.instant());
        
        // When
        int attempted = worker.pump();
        
        // Then
        assertEquals(0, attempted);
        assertEquals(0, calls.get());
        assertEquals(2, backend.queuedCount());
        assertEquals(0, backend.inFlightCount());
        List<WebhookQueueItem> returned = backend.claimDue(clock.instant(), 10, clock.instant().plusSeconds(60));
        assertEquals(0, returned.get(0).getAttemptCount());
        assertEquals(0, returned.get(1).getAttemptCount());
    }
    
    @Test
    void testPump_SaturatedPoolNeverRunsHandlerOnWorkerThread() throws Exception {
        // Given - single-slot pool whose slot is taken
        properties.setTimeoutMs(1000);
        ThreadPoolExecutor pool = new ThreadPoolExecutor(1, 1, 0, TimeUnit.SECONDS,
                new SynchronousQueue<>(), new ThreadPoolExecutor.AbortPolicy());
        CountDownLatch release = new CountDownLatch(1);
        try {
            pool.execute(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            Thread workerThread = Thread.currentThread();
            AtomicInteger callsOnWorkerThread = new AtomicInteger();
            WebhookHandler slow = item -> {
                calls.incrementAndGet();
                if (Thread.currentThread() == workerThread) {
                    callsOnWorkerThread.incrementAndGet();
                }
                Thread.sleep(3_000);
            };
            WebhookQueueWorker worker = new WebhookQueueWorker(backend,
                    new WebhookDispatcher(slow, pool, properties), properties,
                    new BackoffCalculator(2000, 300_000, 0.0), meterRegistry, clock);
            backend.schedule(item("item-1"), clock.instant());
            
            // When
            long started = System.nanoTime();
            worker.pump();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            
            // Then
            assertEquals(0, callsOnWorkerThread.get());
            assertEquals(0, calls.get());
            assertTrue(elapsedMs < 1000, "pump blocked for " + elapsedMs + " ms");
            assertEquals(1, backend.queuedCount());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }
    
    private WebhookQueueWorker worker(WebhookHandler handler) {
        WebhookDispatcher dispatcher = new WebhookDispatcher(handler, Runnable::run, properties);
        return new WebhookQueueWorker(backend, dispatcher, properties,
                new BackoffCalculator(2000, 300_000, 0.0), meterRegistry, clock);
    }
    
    private void drain(WebhookQueueWorker worker, int rounds) {
        for (int i = 0; i < rounds; i++) {
            worker.pump();
            clock.advance(Duration.ofMinutes(10));
        }
    }
    
    private WebhookQueueItem item(String id) {
        return WebhookQueueItem.builder()
                .id(id)
                .tenantId("tenant-1")
                .payload("{\"id\": \"" + id + "\"}")
                .receivedAt(clock.instant())
                .status(WebhookItemStatus.QUEUED)
                .build();
    }
    
    /**
     * In-memory backend that can fail the next outcome write once.
     */
    private static final class FlakyBackend extends InMemoryWebhookQueueBackend {
        
        private boolean failNextSchedule;
        private boolean failNextComplete;
        private boolean failNextFail;
        
        @Override
        public synchronized void schedule(WebhookQueueItem item, Instant availableAt) {
            if (failNextSchedule) {
                failNextSchedule = false;
                throw new QueueBackendUnavailableException("redis down", null);
            }
            super.schedule(item, availableAt);
        }
        
        @Override
        public synchronized void complete(WebhookQueueItem item, int keep) {
            if (failNextComplete) {
                failNextComplete = false;
                throw new QueueBackendUnavailableException("redis down", null);
            }
            super.complete(item, keep);
        }
        
        @Override
        public synchronized void fail(WebhookQueueItem item, int keep) {
            if (failNextFail) {
                failNextFail = false;
                throw new QueueBackendUnavailableException("redis down", null);
            }
            super.fail(item, keep);
        }
    }
    
    private static final class MutableClock extends Clock {
        
        private Instant now;
        
        private MutableClock(Instant now) {
            this.now = now;
        }
        
        void advance(Duration duration) {
            now = now.plus(duration);
        }
        
        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }
        
        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
        
        @Override
        public Instant instant() {
            return now;
        }
    }
}
