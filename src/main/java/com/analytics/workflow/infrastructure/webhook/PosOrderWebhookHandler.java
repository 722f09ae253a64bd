package com.analytics.workflow.infrastructure.webhook;

import com.analytics.workflow.domain.model.SourceKey;
import com.analytics.workflow.domain.model.WebhookQueueItem;
import com.analytics.workflow.domain.webhook.WebhookHandler;
import com.analytics.workflow.infrastructure.source.SourceRecordWriter;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies POS order webhooks as source records.
 * 
 * Accepted bodies: a single order object, {"data": [orders]} or
 * {"orders": [orders]}. Orders are upserted by (tenant, pos, id), so a
 * redelivered webhook rewrites the same rows.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PosOrderWebhookHandler implements WebhookHandler {
    
    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {
    };
    
    private final ObjectMapper objectMapper;
    private final SourceRecordWriter recordWriter;
    
    @Override
    public void handle(WebhookQueueItem item) throws Exception {
        Map<String, Object> body = objectMapper.readValue(item.getPayload(), BODY_TYPE);
        List<Map<String, Object>> orders = extractOrders(body);
        
        if (orders.isEmpty()) {
            log.debug("Webhook item {} for tenant {} carries no orders", item.getId(), item.getTenantId());
            return;
        }
        
        int applied = 0;
        for (Map<String, Object> order : orders) {
            Object id = order.get("id");
            if (id == null || id.toString().isBlank()) {
                log.debug("Skipping order without id in webhook item {}", item.getId());
                continue;
            }
            recordWriter.upsert(item.getTenantId(), SourceKey.POS, id.toString(), orderDate(order), order, null);
            applied++;
        }
        log.info("Webhook item {} applied {} POS orders for tenant {}", item.getId(), applied, item.getTenantId());
    }
    
    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> extractOrders(Map<String, Object> body) {
        List<Map<String, Object>> orders = new ArrayList<>();
        if (body == null) {
            return orders;
        }
        
        Object list = body.containsKey("data") ? body.get("data") : body.get("orders");
        if (list instanceof List) {
            for (Object entry : (List<Object>) list) {
                if (entry instanceof Map) {
                    orders.add((Map<String, Object>) entry);
                }
            }
            return orders;
        }
        if (list instanceof Map) {
            orders.add((Map<String, Object>) list);
            return orders;
        }
        
        if (body.containsKey("id")) {
            orders.add(body);
        }
        return orders;
    }
    
    static LocalDate orderDate(Map<String, Object> order) {
        Object value = order.get("inserted_at");
        if (value == null) {
            value = order.get("created_at");
        }
        if (value == null || value.toString().length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(value.toString().substring(0, 10));
        } catch (DateTimeParseException e) {
            log.debug("Order {} has unparseable date '{}'", order.get("id"), value);
            return null;
        }
    }
}
