package io.github.drompincen.scriptops.gateway.config;

import io.github.drompincen.scriptops.gateway.websocket.ExecutionWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Exposes the live execution stream. Path and allowed origins come from
 * {@code scriptops.websocket.*}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ExecutionWebSocketHandler executionStream;
    private final String path;
    private final String[] allowedOrigins;

    public WebSocketConfig(ExecutionWebSocketHandler executionStream,
                           @Value("${scriptops.websocket.path:/ws}") String path,
                           @Value("${scriptops.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.executionStream = executionStream;
        this.path = path;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(executionStream, path).setAllowedOrigins(allowedOrigins);
    }
}
