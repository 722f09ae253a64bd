package com.analytics.workflow.domain.webhook;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter for webhook redelivery.
 * 
 * delay = min(base * 2^(attempt-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * 
 * Example (base=2000ms, jitterFactor=0.1):
 * - attempt 1: 2000-2200ms
 * - attempt 2: 4000-4400ms
 * - attempt 3: 8000-8800ms
 */
public class BackoffCalculator {
    
    // 2^30 * base already exceeds any sane max delay
    private static final int MAX_SHIFT = 30;
    
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;
    
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }
    
    /**
     * @param random source of values in [0, 1)
     * @throws IllegalArgumentException on a non-positive base, max below
     *         base or jitter outside [0, 1]
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                    "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }
    
    /**
     * @param attemptCount attempts made so far, starting at 1
     * @return delay before the next attempt in milliseconds
     */
    public long calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + attemptCount + ")");
        }
        
        int shift = Math.min(attemptCount - 1, MAX_SHIFT);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        
        return Math.min(exponential + jitter, maxDelayMs);
    }
    
    public long getBaseDelayMs() {
        return baseDelayMs;
    }
    
    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
