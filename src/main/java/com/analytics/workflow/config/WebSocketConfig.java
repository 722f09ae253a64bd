package com.analytics.workflow.config;

import com.analytics.workflow.infrastructure.websocket.ExecutionWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {
    
    private final ExecutionWebSocketHandler executionWebSocketHandler;
    private final WorkflowEngineProperties properties;
    
    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(executionWebSocketHandler, "/ws/workflows")
                .setAllowedOriginPatterns(properties.getWebsocket().getAllowedOrigins());
    }
}
