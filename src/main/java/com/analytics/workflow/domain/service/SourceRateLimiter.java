package com.analytics.workflow.domain.service;

import com.analytics.workflow.domain.model.SourceKey;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Minimum-delay gate per source.
 * 
 * acquire(source) returns once at least minDelayMs has passed since the
 * previous grant of that same source. Sources never wait on each other.
 * One instance per execution; concurrent executions each get their own
 * limiter, so their delays are independent.
 * 
 * Never throws. If the waiting thread is interrupted the grant is given
 * immediately and the interrupt flag is restored for the caller.
 */
@Slf4j
public class SourceRateLimiter {
    
    private final Map<SourceKey, Gate> gates = new EnumMap<>(SourceKey.class);
    private final LongSupplier nanoTime;
    private final Sleeper sleeper;
    
    public SourceRateLimiter(Map<SourceKey, Long> minDelaysMs) {
        this(minDelaysMs, System::nanoTime, Sleeper.THREAD);
    }
    
    public SourceRateLimiter(Map<SourceKey, Long> minDelaysMs, LongSupplier nanoTime, Sleeper sleeper) {
        this.nanoTime = nanoTime;
        this.sleeper = sleeper;
        for (SourceKey source : SourceKey.values()) {
            Long delay = minDelaysMs.get(source);
            gates.put(source, new Gate(delay == null ? 0L : Math.max(0L, delay)));
        }
    }
    
    /**
     * Blocks until the source may make its next call.
     *
     * @return milliseconds actually waited
     */
    public long acquire(SourceKey source) {
        Gate gate = gates.get(source);
        gate.lock.lock();
        try {
            long waited = 0;
            if (gate.lastGrantNanos != null && gate.minDelayMs > 0) {
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(nanoTime.getAsLong() - gate.lastGrantNanos);
                long remaining = gate.minDelayMs - elapsedMs;
                if (remaining > 0) {
                    waited = pause(source, remaining);
                }
            }
            gate.lastGrantNanos = nanoTime.getAsLong();
            return waited;
        } finally {
            gate.lock.unlock();
        }
    }
    
    public long getMinDelayMs(SourceKey source) {
        return gates.get(source).minDelayMs;
    }
    
    private long pause(SourceKey source, long millis) {
        log.debug("Rate limiting {} for {} ms", source, millis);
        try {
            sleeper.sleep(millis);
            return millis;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Rate limit wait for {} interrupted, granting early", source);
            return 0;
        }
    }
    
    private static final class Gate {
        private final long minDelayMs;
        private final ReentrantLock lock = new ReentrantLock();
        private Long lastGrantNanos;
        
        private Gate(long minDelayMs) {
            this.minDelayMs = minDelayMs;
        }
    }
}
