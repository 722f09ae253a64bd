package com.analytics.workflow.infrastructure.websocket;

import com.analytics.workflow.domain.exception.ExecutionNotFoundException;
import com.analytics.workflow.domain.model.ExecutionEvent;
import com.analytics.workflow.domain.model.ExecutionEventKind;
import com.analytics.workflow.domain.model.ExecutionSnapshot;
import com.analytics.workflow.domain.model.ExecutionStatus;
import com.analytics.workflow.domain.model.TenantContext;
import com.analytics.workflow.domain.service.ExecutionEventPublisher;
import com.analytics.workflow.domain.service.ExecutionQueryService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ExecutionWebSocketHandler with a mocked session.
 * Event delivery runs on the calling thread.
 */
@ExtendWith(MockitoExtension.class)
class ExecutionWebSocketHandlerTest {
    
    @Mock
    private WebSocketSession session;
    
    @Mock
    private ExecutionQueryService executionQueryService;
    
    private ObjectMapper objectMapper;
    private ExecutionEventPublisher publisher;
    private ExecutionWebSocketHandler handler;
    
    @BeforeEach
    void setUp() throws Exception {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        publisher = new ExecutionEventPublisher(Runnable::run, List.of());
        handler = new ExecutionWebSocketHandler(publisher, executionQueryService, objectMapper);
        
        lenient().when(session.getId()).thenReturn("session-1");
        lenient().when(session.isOpen()).thenReturn(true);
        handler.afterConnectionEstablished(session);
    }
    
    @Test
    void testSubscribeExecution_SnapshotThenLiveEvents() throws Exception {
        // Given
        ExecutionSnapshot snapshot = ExecutionSnapshot.builder()
                .executionId("exec-1")
                .workflowId("wf-1")
                .tenantId("tenant-1")
                .status(ExecutionStatus.RUNNING)
                .totalDays(3)
                .daysProcessed(1)
                .sources(Map.of())
                .errors(List.of())
                .build();
        when(executionQueryService.get(TenantContext.of("tenant-1"), "exec-1")).thenReturn(snapshot);
        
        // When
        handler.handleTextMessage(session, new TextMessage(
                "{\"type\": \"subscribe:execution\", \"tenantId\": \"tenant-1\", \"executionId\": \"exec-1\"}"));
        publisher.publish(ExecutionEvent.builder()
                .executionId("exec-1")
                .tenantId("tenant-1")
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .eventKind(ExecutionEventKind.DAY_COMPLETED)
                .payload(Map.of("daysProcessed", 2))
                .build());
        
        // Then
        List<JsonNode> frames = sentFrames(2);
        assertEquals("execution:snapshot", frames.get(0).get("type").asText());
        assertEquals(1, frames.get(0).get("snapshot").get("daysProcessed").asInt());
        assertEquals("execution:day_completed", frames.get(1).get("eventKind").asText());
        assertEquals(2, frames.get(1).get("payload").get("daysProcessed").asInt());
    }
    
    @Test
    void testSubscribeExecution_UnknownExecutionSendsError() throws Exception {
        // Given
        when(executionQueryService.get(TenantContext.of("tenant-1"), "missing"))
                .thenThrow(new ExecutionNotFoundException("missing"));
        
        // When
        handler.handleTextMessage(session, new TextMessage(
                "{\"type\": \"subscribe:execution\", \"tenantId\": \"tenant-1\", \"executionId\": \"missing\"}"));
        
        // Then
        List<JsonNode> frames = sentFrames(1);
        assertEquals("error", frames.get(0).get("type").asText());
        assertEquals(0, publisher.getSubscriptionCount());
    }
    
    @Test
    void testSubscribeTenant_TeamFilterAndCloseUnsubscribes() throws Exception {
        // When
        handler.handleTextMessage(session, new TextMessage(
                "{\"type\": \"subscribe:tenant\", \"tenantId\": \"tenant-1\", \"teamId\": \"team-a\"}"));
        publisher.publish(event("exec-1", "team-a"));
        publisher.publish(event("exec-2", "team-b"));
        
        // Then
        List<JsonNode> frames = sentFrames(2);
        assertEquals("subscribed", frames.get(0).get("type").asText());
        assertEquals("exec-1", frames.get(1).get("executionId").asText());
        
        // When
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);
        
        // Then
        assertEquals(0, publisher.getSubscriptionCount());
    }
    
    @Test
    void testHandleTextMessage_RejectsBadFrames() throws Exception {
        // When
        handler.handleTextMessage(session, new TextMessage("not json"));
        handler.handleTextMessage(session, new TextMessage("{\"type\": \"subscribe:everything\"}"));
        handler.handleTextMessage(session, new TextMessage("{\"type\": \"subscribe:tenant\"}"));
        
        // Then
        List<JsonNode> frames = sentFrames(3);
        for (JsonNode frame : frames) {
            assertEquals("error", frame.get("type").asText());
        }
        verifyNoInteractions(executionQueryService);
    }
    
    private List<JsonNode> sentFrames(int expected) throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, times(expected)).sendMessage(captor.capture());
        List<JsonNode> frames = new ArrayList<>();
        for (TextMessage message : captor.getAllValues()) {
            frames.add(objectMapper.readTree(message.getPayload()));
        }
        return frames;
    }
    
    private static ExecutionEvent event(String executionId, String teamId) {
        return ExecutionEvent.builder()
                .executionId(executionId)
                .tenantId("tenant-1")
                .teamId(teamId)
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .eventKind(ExecutionEventKind.STARTED)
                .payload(Map.of())
                .build();
    }
}
