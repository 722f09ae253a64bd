package com.analytics.workflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Workflow Execution Engine
 * 
 * Runs tenant-defined data-sync workflows that pull day-by-day records from
 * the ads and POS source APIs, and relays inbound POS webhooks through a
 * durable retry queue.
 * 
 * Architecture:
 * - REST APIs for workflow definitions, triggers and execution history
 * - Cron scheduling with overlap protection
 * - Per-source rate limiting with concurrent source fetches per day
 * - Live progress over WebSocket, cached in Redis for polling clients
 * - Redis-backed webhook queue with exponential backoff and inline fallback
 * - Stale execution reconciliation after crashes
 */
@SpringBootApplication
@EnableAsync
@EnableScheduling
public class WorkflowEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkflowEngineApplication.class, args);
    }
}
