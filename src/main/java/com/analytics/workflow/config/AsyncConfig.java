package com.analytics.workflow.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools of the engine.
 * 
 * - executionExecutor: one orchestrator run per task
 * - sourceExecutor: per-day source fetch/process tasks
 * - eventExecutor: drains subscriber delivery queues
 * - webhookHandlerExecutor: webhook handler calls, bounded by the item timeout
 */
@Slf4j
@Configuration
public class AsyncConfig {
    
    @Bean(name = "executionExecutor")
    public ThreadPoolTaskExecutor executionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("workflow-exec-");
        // Runs reject rather than block the caller; the trigger reports the failure.
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        
        log.info("Initialized execution executor - Core: {}, Max: {}, Queue: {}", 4, 16, 200);
        return executor;
    }
    
    @Bean(name = "sourceExecutor")
    public ThreadPoolTaskExecutor sourceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("workflow-source-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        
        log.info("Initialized source executor - Core: {}, Max: {}, Queue: {}", 8, 32, 500);
        return executor;
    }
    
    @Bean(name = "eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(2000);
        executor.setThreadNamePrefix("workflow-event-");
        // A rejected drain stays queued on its subscription and is retried on the next publish.
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        
        log.info("Initialized event executor - Core: {}, Max: {}, Queue: {}", 2, 8, 2000);
        return executor;
    }
    
    @Bean(name = "webhookHandlerExecutor")
    public ThreadPoolTaskExecutor webhookHandlerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("webhook-handler-");
        // Handlers never run on the worker thread, where the timeout could not be enforced.
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        
        log.info("Initialized webhook handler executor - Core: {}, Max: {}, Queue: {}", 4, 16, 100);
        return executor;
    }
}
