package com.analytics.workflow.domain.webhook;

import com.analytics.workflow.config.WebhookQueueProperties;
import com.analytics.workflow.domain.exception.QueueBackendUnavailableException;
import com.analytics.workflow.domain.exception.ValidationException;
import com.analytics.workflow.domain.model.QueueStatusView;
import com.analytics.workflow.domain.model.WebhookItemStatus;
import com.analytics.workflow.domain.model.WebhookQueueItem;
import com.analytics.workflow.domain.model.WebhookReceipt;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebhookRelayQueueTest {
    
    private static final String PAYLOAD = "{\"id\": \"order-1\", \"total\": 120.5}";
    
    @Mock
    private WebhookQueueBackend backend;
    
    @Mock
    private WebhookHandler handler;
    
    private WebhookQueueProperties properties;
    private WebhookRelayQueue relayQueue;
    
    @BeforeEach
    void setUp() {
        properties = new WebhookQueueProperties();
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        WebhookDispatcher dispatcher = new WebhookDispatcher(handler, Runnable::run, properties);
        relayQueue = new WebhookRelayQueue(backend, dispatcher, properties, new SimpleMeterRegistry(), clock);
    }
    
    @Test
    void testEnqueue_QueuedWhenBackendAvailable() throws Exception {
        // When
        WebhookReceipt receipt = relayQueue.enqueue("tenant-1", PAYLOAD);
        
        // Then
        assertTrue(receipt.isQueued());
        assertEquals(WebhookReceipt.MODE_QUEUED, receipt.getProcessingMode());
        ArgumentCaptor<WebhookQueueItem> captor = ArgumentCaptor.forClass(WebhookQueueItem.class);
        verify(backend).schedule(captor.capture(), any());
        assertEquals(PAYLOAD, captor.getValue().getPayload());
        assertEquals(0, captor.getValue().getAttemptCount());
        verifyNoInteractions(handler);
    }
    
    @Test
    void testEnqueue_FallsBackInlineWhenBackendDown() throws Exception {
        // Given
        doThrow(new QueueBackendUnavailableException("redis down", null)).when(backend).schedule(any(), any());
        
        // When
        WebhookReceipt receipt = relayQueue.enqueue("tenant-1", PAYLOAD);
        
        // Then
        assertFalse(receipt.isQueued());
        assertEquals(WebhookReceipt.MODE_INLINE_FALLBACK, receipt.getProcessingMode());
        assertEquals(WebhookItemStatus.INLINE_COMPLETED, receipt.getStatus());
        verify(handler, times(1)).handle(any());
        verify(backend, times(1)).schedule(any(), any());
        assertEquals(1, relayQueue.getInlineProcessedCount());
    }
    
    @Test
    void testEnqueue_RejectedWhenBackendDownAndNoFallback() {
        // Given
        properties.setInlineFallback(false);
        doThrow(new QueueBackendUnavailableException("redis down", null)).when(backend).schedule(any(), any());
        
        // When/Then
        assertThrows(QueueBackendUnavailableException.class, () -> relayQueue.enqueue("tenant-1", PAYLOAD));
        verifyNoInteractions(handler);
    }
    
    @Test
    void testEnqueue_InlineModeNeverTouchesBackend() throws Exception {
        // Given
        properties.setInlineProcessing(true);
        
        // When
        WebhookReceipt receipt = relayQueue.enqueue("tenant-1", PAYLOAD);
        
        // Then
        assertEquals(WebhookReceipt.MODE_INLINE, receipt.getProcessingMode());
        verify(handler).handle(any());
        verifyNoInteractions(backend);
    }
    
    @Test
    void testEnqueue_InlineFailureReportedNotThrown() throws Exception {
        // Given
        properties.setInlineProcessing(true);
        doThrow(new IllegalStateException("duplicate key")).when(handler).handle(any());
        
        // When
        WebhookReceipt receipt = relayQueue.enqueue("tenant-1", PAYLOAD);
        
        // Then
        assertEquals(WebhookItemStatus.INLINE_FAILED, receipt.getStatus());
        assertEquals("duplicate key", receipt.getError());
        assertEquals(1, relayQueue.getInlineFailedCount());
        assertEquals(0, relayQueue.getInlineProcessedCount());
    }
    
    @Test
    void testEnqueue_RejectsEmptyInput() {
        assertThrows(ValidationException.class, () -> relayQueue.enqueue("tenant-1", " "));
        assertThrows(ValidationException.class, () -> relayQueue.enqueue("", PAYLOAD));
        verifyNoInteractions(backend);
    }
    
    @Test
    void testStatus_ReportsUnavailableBackend() {
        // Given
        when(backend.name()).thenReturn("redis");
        when(backend.queuedCount()).thenThrow(new QueueBackendUnavailableException("redis down", null));
        
        // When
        QueueStatusView status = relayQueue.status();
        
        // Then
        assertFalse(status.isAvailable());
        assertEquals("redis", status.getBackend());
        assertTrue(status.getFailedItems().isEmpty());
    }
}
