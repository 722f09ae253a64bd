package com.analytics.workflow.config;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

import static org.junit.jupiter.api.Assertions.*;

class AsyncConfigTest {
    
    private final AsyncConfig config = new AsyncConfig();
    
    @Test
    void testWebhookHandlerExecutor_RejectsInsteadOfRunningOnCaller() {
        // When
        ThreadPoolTaskExecutor executor = config.webhookHandlerExecutor();
        
        // Then
        try {
            assertInstanceOf(ThreadPoolExecutor.AbortPolicy.class,
                    executor.getThreadPoolExecutor().getRejectedExecutionHandler());
        } finally {
            executor.shutdown();
        }
    }
    
    @Test
    void testEventExecutor_RejectsInsteadOfRunningOnCaller() {
        // When
        ThreadPoolTaskExecutor executor = config.eventExecutor();
        
        // Then
        try {
            assertInstanceOf(ThreadPoolExecutor.AbortPolicy.class,
                    executor.getThreadPoolExecutor().getRejectedExecutionHandler());
        } finally {
            executor.shutdown();
        }
    }
}
