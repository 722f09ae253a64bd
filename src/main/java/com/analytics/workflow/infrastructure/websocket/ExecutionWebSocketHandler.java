package com.analytics.workflow.infrastructure.websocket;

import com.analytics.workflow.domain.exception.WorkflowEngineException;
import com.analytics.workflow.domain.model.ExecutionEventKind;
import com.analytics.workflow.domain.model.ExecutionSnapshot;
import com.analytics.workflow.domain.model.TenantContext;
import com.analytics.workflow.domain.service.ExecutionEventPublisher;
import com.analytics.workflow.domain.service.ExecutionEventPublisher.Subscription;
import com.analytics.workflow.domain.service.ExecutionQueryService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Live execution updates over WebSocket at /ws/workflows.
 * 
 * Client frames:
 * - {"type": "subscribe:execution", "tenantId": "t1", "executionId": "..."}
 * - {"type": "subscribe:tenant", "tenantId": "t1", "teamId": "optional"}
 * - {"type": "unsubscribe"}
 * 
 * An execution subscription is opened paused, the current snapshot is sent
 * as an "execution:snapshot" frame, then live events follow. Events that
 * raced the snapshot may repeat state the snapshot already shows.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionWebSocketHandler extends TextWebSocketHandler {
    
    static final String SUBSCRIBE_EXECUTION = "subscribe:execution";
    static final String SUBSCRIBE_TENANT = "subscribe:tenant";
    static final String UNSUBSCRIBE = "unsubscribe";
    
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;
    
    private final ExecutionEventPublisher eventPublisher;
    private final ExecutionQueryService executionQueryService;
    private final ObjectMapper objectMapper;
    
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, List<Subscription>> subscriptions = new ConcurrentHashMap<>();
    
    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
        log.debug("WebSocket connected: {}", session.getId());
    }
    
    @Override
    protected void handleTextMessage(WebSocketSession rawSession, TextMessage message) throws Exception {
        WebSocketSession session = sessions.getOrDefault(rawSession.getId(), rawSession);
        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            sendError(session, "Frame is not valid JSON");
            return;
        }
        
        String type = text(frame, "type");
        if (type == null) {
            sendError(session, "Frame type is required");
            return;
        }
        
        try {
            switch (type) {
                case SUBSCRIBE_EXECUTION:
                    subscribeExecution(session, frame);
                    break;
                case SUBSCRIBE_TENANT:
                    subscribeTenant(session, frame);
                    break;
                case UNSUBSCRIBE:
                    closeSubscriptions(session.getId());
                    send(session, frame("unsubscribed"));
                    break;
                default:
                    sendError(session, "Unknown frame type: " + type);
            }
        } catch (WorkflowEngineException | IllegalArgumentException e) {
            sendError(session, e.getMessage());
        }
    }
    
    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        closeSubscriptions(session.getId());
        sessions.remove(session.getId());
        log.debug("WebSocket closed: {} ({})", session.getId(), status);
    }
    
    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error on {}: {}", session.getId(), exception.getMessage());
        closeSubscriptions(session.getId());
    }
    
    private void subscribeExecution(WebSocketSession session, JsonNode frame) throws IOException {
        TenantContext tenant = TenantContext.of(text(frame, "tenantId"), text(frame, "teamId"));
        String executionId = text(frame, "executionId");
        if (executionId == null) {
            sendError(session, "executionId is required");
            return;
        }
        
        Subscription subscription = eventPublisher.subscribeExecution(
                executionId, event -> send(session, objectMapper.writeValueAsString(event)), true);
        
        ExecutionSnapshot snapshot;
        try {
            snapshot = executionQueryService.get(tenant, executionId);
        } catch (RuntimeException e) {
            eventPublisher.unsubscribe(subscription);
            throw e;
        }
        
        track(session.getId(), subscription);
        
        Map<String, Object> snapshotFrame = frame(ExecutionEventKind.SNAPSHOT.getWireName());
        snapshotFrame.put("executionId", executionId);
        snapshotFrame.put("snapshot", snapshot);
        send(session, snapshotFrame);
        
        eventPublisher.resume(subscription);
        log.debug("Session {} subscribed to execution {}", session.getId(), executionId);
    }
    
    private void subscribeTenant(WebSocketSession session, JsonNode frame) throws IOException {
        TenantContext tenant = TenantContext.of(text(frame, "tenantId"), text(frame, "teamId"));
        Subscription subscription = eventPublisher.subscribeTenant(
                tenant.getTenantId(),
                tenant.getTeamId(),
                event -> send(session, objectMapper.writeValueAsString(event)),
                false);
        track(session.getId(), subscription);
        
        Map<String, Object> ack = frame("subscribed");
        ack.put("tenantId", tenant.getTenantId());
        ack.put("teamId", tenant.getTeamId());
        send(session, ack);
        log.debug("Session {} subscribed to tenant {} (team {})", session.getId(), tenant.getTenantId(), tenant.getTeamId());
    }
    
    private void track(String sessionId, Subscription subscription) {
        subscriptions.computeIfAbsent(sessionId, id -> new CopyOnWriteArrayList<>()).add(subscription);
    }
    
    private void closeSubscriptions(String sessionId) {
        List<Subscription> open = subscriptions.remove(sessionId);
        if (open != null) {
            open.forEach(eventPublisher::unsubscribe);
        }
    }
    
    private void sendError(WebSocketSession session, String message) throws IOException {
        Map<String, Object> error = frame("error");
        error.put("message", message);
        send(session, error);
    }
    
    private void send(WebSocketSession session, Map<String, Object> frame) throws IOException {
        send(session, objectMapper.writeValueAsString(frame));
    }
    
    private static void send(WebSocketSession session, String json) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("WebSocket session " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(json));
    }
    
    private static Map<String, Object> frame(String type) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", type);
        return frame;
    }
    
    private static String text(JsonNode frame, String field) {
        JsonNode value = frame.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}
