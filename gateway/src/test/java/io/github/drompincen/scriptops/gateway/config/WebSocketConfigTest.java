package io.github.drompincen.scriptops.gateway.config;

import io.github.drompincen.scriptops.gateway.websocket.ExecutionWebSocketHandler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistration;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class WebSocketConfigTest {

    @Mock private ExecutionWebSocketHandler handler;
    @Mock private WebSocketHandlerRegistry registry;
    @Mock private WebSocketHandlerRegistration registration;

    @Test
    void registersExecutionStreamAtConfiguredPath() {
        when(registry.addHandler(handler, "/live")).thenReturn(registration);

        new WebSocketConfig(handler, "/live", new String[] {"https://ops.example.com"})
                .registerWebSocketHandlers(registry);

        verify(registry).addHandler(handler, "/live");
        verify(registration).setAllowedOrigins("https://ops.example.com");
    }
}
