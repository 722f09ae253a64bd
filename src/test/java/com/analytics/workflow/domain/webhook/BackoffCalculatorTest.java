package com.analytics.workflow.domain.webhook;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BackoffCalculatorTest {
    
    @Test
    void testCalculate_DoublesWithoutJitter() {
        // Given
        BackoffCalculator calculator = new BackoffCalculator(2000, 300_000, 0.1, () -> 0.0);
        
        // When/Then
        assertEquals(2000, calculator.calculate(1));
        assertEquals(4000, calculator.calculate(2));
        assertEquals(8000, calculator.calculate(3));
        assertEquals(16000, calculator.calculate(4));
    }
    
    @Test
    void testCalculate_JitterStaysWithinFactor() {
        // Given
        BackoffCalculator calculator = new BackoffCalculator(2000, 300_000, 0.1, () -> 0.999);
        
        // When
        long delay = calculator.calculate(2);
        
        // Then
        assertTrue(delay >= 4000 && delay <= 4400, "delay was " + delay);
    }
    
    @Test
    void testCalculate_CappedAtMaxDelay() {
        // Given
        BackoffCalculator calculator = new BackoffCalculator(2000, 10_000, 0.5, () -> 0.9);
        
        // When/Then
        assertEquals(10_000, calculator.calculate(4));
        assertEquals(10_000, calculator.calculate(100));
    }
    
    @Test
    void testCalculate_RandomJitterBounds() {
        // Given
        BackoffCalculator calculator = new BackoffCalculator(1000, 60_000, 0.2);
        
        // When/Then
        for (int i = 0; i < 50; i++) {
            long delay = calculator.calculate(3);
            assertTrue(delay >= 4000 && delay <= 4800, "delay was " + delay);
        }
    }
    
    @Test
    void testConstructor_RejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(0, 1000, 0.1));
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(2000, 1000, 0.1));
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(1000, 2000, 1.5));
    }
    
    @Test
    void testCalculate_RejectsNonPositiveAttempt() {
        BackoffCalculator calculator = new BackoffCalculator(1000, 2000, 0.0);
        
        assertThrows(IllegalArgumentException.class, () -> calculator.calculate(0));
    }
}
