package com.analytics.workflow.infrastructure.webhook;

import com.analytics.workflow.domain.model.SourceKey;
import com.analytics.workflow.domain.model.WebhookQueueItem;
import com.analytics.workflow.infrastructure.source.SourceRecordWriter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PosOrderWebhookHandlerTest {
    
    @Mock
    private SourceRecordWriter recordWriter;
    
    private PosOrderWebhookHandler handler;
    
    @BeforeEach
    void setUp() {
        handler = new PosOrderWebhookHandler(new ObjectMapper(), recordWriter);
    }
    
    @Test
    void testHandle_SingleOrderUpsertedById() throws Exception {
        // Given
        WebhookQueueItem item = item("{\"id\": \"ord-9\", \"inserted_at\": \"2024-01-02T10:15:00Z\", \"total\": 12}");
        
        // When
        handler.handle(item);
        
        // Then
        verify(recordWriter).upsert(eq("tenant-1"), eq(SourceKey.POS), eq("ord-9"),
                eq(LocalDate.of(2024, 1, 2)), anyMap(), isNull());
    }
    
    @Test
    void testHandle_OrderListSkipsMissingIds() throws Exception {
        // Given
        WebhookQueueItem item = item("{\"orders\": [{\"id\": 1}, {\"total\": 5}, {\"id\": 2}]}");
        
        // When
        handler.handle(item);
        
        // Then
        verify(recordWriter, times(2)).upsert(eq("tenant-1"), eq(SourceKey.POS), any(), isNull(), anyMap(), isNull());
    }
    
    @Test
    void testHandle_RedeliveryWritesSameKey() throws Exception {
        // Given
        WebhookQueueItem item = item("{\"data\": [{\"id\": \"ord-1\"}]}");
        
        // When
        handler.handle(item);
        handler.handle(item);
        
        // Then
        verify(recordWriter, times(2)).upsert(eq("tenant-1"), eq(SourceKey.POS), eq("ord-1"), any(), anyMap(), any());
    }
    
    @Test
    void testHandle_MalformedPayloadFails() {
        assertThrows(JsonProcessingException.class, () -> handler.handle(item("not json")));
        verifyNoInteractions(recordWriter);
    }
    
    @Test
    void testOrderDate_FallsBackAndTolerates() {
        assertEquals(LocalDate.of(2024, 5, 1), PosOrderWebhookHandler.orderDate(Map.of("created_at", "2024-05-01")));
        assertNull(PosOrderWebhookHandler.orderDate(Map.of("inserted_at", "yesterday!")));
        assertNull(PosOrderWebhookHandler.orderDate(Map.of("id", "x")));
    }
    
    private static WebhookQueueItem item(String payload) {
        return WebhookQueueItem.builder()
                .id("item-1")
                .tenantId("tenant-1")
                .payload(payload)
                .build();
    }
}
