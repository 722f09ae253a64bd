package com.analytics.workflow.infrastructure.cache;

import com.analytics.workflow.config.WorkflowEngineProperties;
import com.analytics.workflow.domain.model.ExecutionProgress;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Last-known progress per execution, kept in Redis.
 * 
 * Written after every progress change of a running execution and read by
 * the progress endpoint, so polling clients do not hit the database.
 * Entries expire after workflow-engine.progress.ttl-seconds (24h default).
 * 
 * Best effort: a Redis failure never fails the run. The circuit breaker
 * stops calls while Redis is down and the endpoint falls back to the
 * stored execution record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionProgressCache {
    
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final WorkflowEngineProperties properties;
    
    @CircuitBreaker(name = "redis", fallbackMethod = "getFallback")
    public Optional<ExecutionProgress> get(String executionId) {
        try {
            String cached = redisTemplate.opsForValue().get(key(executionId));
            
            if (cached == null) {
                log.debug("Progress cache miss for execution: {}", executionId);
                return Optional.empty();
            }
            
            return Optional.of(objectMapper.readValue(cached, ExecutionProgress.class));
            
        } catch (JsonProcessingException e) {
            log.error("Unreadable progress entry for execution {}: {}", executionId, e.getMessage());
            return Optional.empty();
        }
    }
    
    @CircuitBreaker(name = "redis", fallbackMethod = "putFallback")
    public void put(ExecutionProgress progress) {
        try {
            String json = objectMapper.writeValueAsString(progress);
            redisTemplate.opsForValue().set(key(progress.getExecutionId()), json,
                    properties.getProgress().getTtlSeconds(), TimeUnit.SECONDS);
            log.debug("Cached progress for execution: {} ({}%)", progress.getExecutionId(), progress.getPercent());
            
        } catch (JsonProcessingException e) {
            log.error("Error serializing progress of execution {}: {}", progress.getExecutionId(), e.getMessage());
        }
    }
    
    @CircuitBreaker(name = "redis", fallbackMethod = "evictFallback")
    public void evict(String executionId) {
        redisTemplate.delete(key(executionId));
        log.debug("Evicted progress for execution: {}", executionId);
    }
    
    String key(String executionId) {
        return properties.getProgress().getKeyPrefix() + ":" + executionId;
    }
    
    // Fallback methods (circuit breaker)
    
    private Optional<ExecutionProgress> getFallback(String executionId, Exception e) {
        log.warn("Progress cache unavailable, reading execution {} from the database: {}", executionId, e.getMessage());
        return Optional.empty();
    }
    
    private void putFallback(ExecutionProgress progress, Exception e) {
        log.warn("Progress cache unavailable, skipping write for execution {}: {}",
                progress.getExecutionId(), e.getMessage());
    }
    
    private void evictFallback(String executionId, Exception e) {
        log.warn("Progress cache unavailable, skipping evict for execution {}: {}", executionId, e.getMessage());
    }
}
