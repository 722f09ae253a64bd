package com.analytics.workflow.domain.service;

import com.analytics.workflow.domain.model.SourceKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SourceRateLimiter against a fake monotonic clock.
 * The fake sleeper advances the clock instead of blocking.
 */
class SourceRateLimiterTest {
    
    private AtomicLong nanos;
    private List<Long> sleeps;
    private SourceRateLimiter limiter;
    
    @BeforeEach
    void setUp() {
        nanos = new AtomicLong(1_000_000_000L);
        sleeps = new ArrayList<>();
        Sleeper sleeper = millis -> {
            sleeps.add(millis);
            nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
        };
        limiter = new SourceRateLimiter(
                Map.of(SourceKey.ADS, 1000L, SourceKey.POS, 500L), nanos::get, sleeper);
    }
    
    @Test
    void testAcquire_FirstCallIsImmediate() {
        // When
        long waited = limiter.acquire(SourceKey.ADS);
        
        // Then
        assertEquals(0, waited);
        assertTrue(sleeps.isEmpty());
    }
    
    @Test
    void testAcquire_ConsecutiveCallsSeparatedByMinDelay() {
        // Given
        limiter.acquire(SourceKey.ADS);
        long firstGrant = nanos.get();
        
        // When
        long waited = limiter.acquire(SourceKey.ADS);
        
        // Then
        assertEquals(1000, waited);
        assertTrue(nanos.get() - firstGrant >= TimeUnit.MILLISECONDS.toNanos(1000));
    }
    
    @Test
    void testAcquire_WaitsOnlyTheRemainder() {
        // Given
        limiter.acquire(SourceKey.ADS);
        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(700));
        
        // When
        long waited = limiter.acquire(SourceKey.ADS);
        
        // Then
        assertEquals(300, waited);
    }
    
    @Test
    void testAcquire_NoWaitWhenDelayAlreadyElapsed() {
        // Given
        limiter.acquire(SourceKey.POS);
        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(2000));
        
        // When
        long waited = limiter.acquire(SourceKey.POS);
        
        // Then
        assertEquals(0, waited);
        assertTrue(sleeps.isEmpty());
    }
    
    @Test
    void testAcquire_SourcesAreIndependent() {
        // Given
        limiter.acquire(SourceKey.ADS);
        
        // When - POS right after ADS
        long waited = limiter.acquire(SourceKey.POS);
        
        // Then
        assertEquals(0, waited);
        assertTrue(sleeps.isEmpty());
    }
    
    @Test
    void testAcquire_MissingDelayMeansNoPacing() {
        // Given
        SourceRateLimiter unpaced = new SourceRateLimiter(Map.of(SourceKey.ADS, 100L), nanos::get, millis -> sleeps.add(millis));
        unpaced.acquire(SourceKey.POS);
        
        // When
        long waited = unpaced.acquire(SourceKey.POS);
        
        // Then
        assertEquals(0, waited);
        assertEquals(0, unpaced.getMinDelayMs(SourceKey.POS));
    }
    
    @Test
    void testAcquire_InterruptGrantsAndRestoresFlag() {
        // Given
        SourceRateLimiter interrupted = new SourceRateLimiter(Map.of(SourceKey.ADS, 1000L), nanos::get, millis -> {
            throw new InterruptedException("stop");
        });
        interrupted.acquire(SourceKey.ADS);
        
        try {
            // When
            long waited = interrupted.acquire(SourceKey.ADS);
            
            // Then
            assertEquals(0, waited);
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
