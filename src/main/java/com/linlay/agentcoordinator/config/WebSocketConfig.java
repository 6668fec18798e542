package com.linlay.agentcoordinator.config;

import com.linlay.agentcoordinator.websocket.AgentWebSocketHandler;
import com.linlay.agentcoordinator.websocket.ClientWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping webSocketHandlerMapping(
            WebSocketProperties properties,
            ClientWebSocketHandler clientHandler,
            AgentWebSocketHandler agentHandler
    ) {
        Map<String, WebSocketHandler> handlers = new LinkedHashMap<>();
        handlers.put(normalize(properties.getClientPath()) + "/*", clientHandler);
        handlers.put(normalize(properties.getAgentPath()) + "/*", agentHandler);
        return new SimpleUrlHandlerMapping(handlers, -1);
    }

    private static String normalize(String path) {
        String trimmed = path == null ? "" : path.trim();
        if (!trimmed.startsWith("/")) {
            trimmed = "/" + trimmed;
        }
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
