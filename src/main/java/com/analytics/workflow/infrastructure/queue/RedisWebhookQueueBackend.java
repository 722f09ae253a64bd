package com.analytics.workflow.infrastructure.queue;

import com.analytics.workflow.config.WebhookQueueProperties;
import com.analytics.workflow.domain.exception.QueueBackendUnavailableException;
import com.analytics.workflow.domain.model.WebhookQueueItem;
import com.analytics.workflow.domain.webhook.WebhookQueueBackend;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Durable webhook queue in Redis.
 * 
 * Keys (prefix = webhook-queue.key-prefix):
 * - {prefix}:ready       sorted set of item ids scored by due epoch millis
 * - {prefix}:inflight    sorted set of claimed item ids scored by lease deadline
 * - {prefix}:item:{id}   item JSON while queued or in flight
 * - {prefix}:completed   list of completed item JSON, newest first, trimmed
 * - {prefix}:failed      list of failed item JSON, newest first, trimmed
 * 
 * Claiming is one Lua script: expired leases go back to the ready set,
 * then due ids move from ready to inflight. Several instances can pump
 * the same queue without claiming an id twice. Recording an outcome
 * writes it before dropping the lease, so a crash in between means a
 * redelivery rather than a lost item.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "webhook-queue", name = "backend", havingValue = "redis", matchIfMissing = true)
public class RedisWebhookQueueBackend implements WebhookQueueBackend {
    
    private static final String CLAIM_SCRIPT = """
        local expired = redis.call('ZRANGEBYSCORE', KEYS[2], '-inf', ARGV[1])
        for _, id in ipairs(expired) do
            redis.call('ZREM', KEYS[2], id)
            redis.call('ZADD', KEYS[1], ARGV[1], id)
        end
        local ids = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', ARGV[1], 'LIMIT', 0, ARGV[2])
        for _, id in ipairs(ids) do
            redis.call('ZREM', KEYS[1], id)
            redis.call('ZADD', KEYS[2], ARGV[3], id)
        end
        return ids
        """;
    
    @SuppressWarnings("rawtypes")
    private static final DefaultRedisScript<List> CLAIM = new DefaultRedisScript<>(CLAIM_SCRIPT, List.class);
    
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final WebhookQueueProperties properties;
    
    @Override
    public String name() {
        return "redis";
    }
    
    @Override
    @CircuitBreaker(name = "webhookQueue", fallbackMethod = "scheduleFallback")
    public void schedule(WebhookQueueItem item, Instant availableAt) {
        String json = toJson(item);
        execute("schedule", () -> {
            redisTemplate.opsForValue().set(itemKey(item.getId()), json);
            redisTemplate.opsForZSet().add(readyKey(), item.getId(), availableAt.toEpochMilli());
            redisTemplate.opsForZSet().remove(inFlightKey(), item.getId());
            return null;
        });
    }
    
    @Override
    @CircuitBreaker(name = "webhookQueue", fallbackMethod = "claimDueFallback")
    public List<WebhookQueueItem> claimDue(Instant now, int max, Instant leaseUntil) {
        return execute("claim", () -> {
            @SuppressWarnings("unchecked")
            List<String> ids = redisTemplate.execute(CLAIM,
                    Arrays.asList(readyKey(), inFlightKey()),
                    String.valueOf(now.toEpochMilli()),
                    String.valueOf(max),
                    String.valueOf(leaseUntil.toEpochMilli()));
            if (ids == null || ids.isEmpty()) {
                return Collections.<WebhookQueueItem>emptyList();
            }
            
            List<WebhookQueueItem> claimed = new ArrayList<>();
            for (String id : ids) {
                String json = redisTemplate.opsForValue().get(itemKey(id));
                if (json == null) {
                    log.warn("Webhook item {} was ready but has no payload, dropping", id);
                    redisTemplate.opsForZSet().remove(inFlightKey(), id);
                    continue;
                }
                WebhookQueueItem item = fromJson(json);
                if (item == null) {
                    // Unreadable entries are parked raw in the failed list instead of cycling through leases.
                    redisTemplate.opsForList().leftPush(failedKey(), json);
                    redisTemplate.opsForZSet().remove(inFlightKey(), id);
                    redisTemplate.delete(itemKey(id));
                    continue;
                }
                claimed.add(item);
            }
            return claimed;
        });
    }
    
    @Override
    public void complete(WebhookQueueItem item, int keep) {
        moveToBucket(completedKey(), item, keep);
    }
    
    @Override
    public void fail(WebhookQueueItem item, int keep) {
        moveToBucket(failedKey(), item, keep);
    }
    
    @Override
    public long queuedCount() {
        return execute("count", () -> nullToZero(redisTemplate.opsForZSet().zCard(readyKey())));
    }
    
    @Override
    public long inFlightCount() {
        return execute("count", () -> nullToZero(redisTemplate.opsForZSet().zCard(inFlightKey())));
    }
    
    @Override
    public long completedCount() {
        return execute("count", () -> nullToZero(redisTemplate.opsForList().size(completedKey())));
    }
    
    @Override
    public long failedCount() {
        return execute("count", () -> nullToZero(redisTemplate.opsForList().size(failedKey())));
    }
    
    @Override
    public List<WebhookQueueItem> failedItems(int limit) {
        return execute("list", () -> {
            List<String> entries = redisTemplate.opsForList().range(failedKey(), 0, Math.max(0, limit - 1));
            List<WebhookQueueItem> items = new ArrayList<>();
            if (entries != null) {
                for (String json : entries) {
                    WebhookQueueItem item = fromJson(json);
                    if (item != null) {
                        items.add(item);
                    }
                }
            }
            return items;
        });
    }
    
    private void moveToBucket(String bucketKey, WebhookQueueItem item, int keep) {
        String json = toJson(item);
        execute("bucket", () -> {
            redisTemplate.opsForList().leftPush(bucketKey, json);
            redisTemplate.opsForList().trim(bucketKey, 0, Math.max(0, keep - 1));
            redisTemplate.opsForZSet().remove(inFlightKey(), item.getId());
            redisTemplate.delete(itemKey(item.getId()));
            return null;
        });
    }
    
    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new QueueBackendUnavailableException("Webhook queue " + operation + " failed: " + e.getMessage(), e);
        }
    }
    
    private String toJson(WebhookQueueItem item) {
        try {
            return objectMapper.writeValueAsString(item);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook item is not serializable: " + e.getOriginalMessage(), e);
        }
    }
    
    private WebhookQueueItem fromJson(String json) {
        try {
            return objectMapper.readValue(json, WebhookQueueItem.class);
        } catch (JsonProcessingException e) {
            log.error("Unreadable webhook queue entry, skipping: {}", e.getMessage());
            return null;
        }
    }
    
    private static long nullToZero(Long value) {
        return value == null ? 0L : value;
    }
    
    private String readyKey() {
        return properties.getKeyPrefix() + ":ready";
    }
    
    private String inFlightKey() {
        return properties.getKeyPrefix() + ":inflight";
    }
    
    private String itemKey(String id) {
        return properties.getKeyPrefix() + ":item:" + id;
    }
    
    private String completedKey() {
        return properties.getKeyPrefix() + ":completed";
    }
    
    private String failedKey() {
        return properties.getKeyPrefix() + ":failed";
    }
    
    // Fallback methods (circuit breaker)
    
    private void scheduleFallback(WebhookQueueItem item, Instant availableAt, Exception e) {
        throw unavailable(e);
    }
    
    private List<WebhookQueueItem> claimDueFallback(Instant now, int max, Instant leaseUntil, Exception e) {
        throw unavailable(e);
    }
    
    private static QueueBackendUnavailableException unavailable(Exception e) {
        if (e instanceof QueueBackendUnavailableException) {
            return (QueueBackendUnavailableException) e;
        }
        return new QueueBackendUnavailableException("Webhook queue unavailable: " + e.getMessage(), e);
    }
}
