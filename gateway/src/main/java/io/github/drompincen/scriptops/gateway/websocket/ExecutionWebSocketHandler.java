package io.github.drompincen.scriptops.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.scriptops.protocol.event.ExecutionEvent;
import io.github.drompincen.scriptops.protocol.event.ExecutionEventType;
import io.github.drompincen.scriptops.protocol.ws.WsMessage;
import io.github.drompincen.scriptops.protocol.ws.WsMessageType;
import io.github.drompincen.scriptops.runtime.execution.ExecutionEventListener;
import io.github.drompincen.scriptops.runtime.execution.ExecutionEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Pushes live execution status and output to WebSocket clients. A client either follows single
 * executions or subscribes to everything. Nothing is replayed on (re)subscription.
 */
@Component
public class ExecutionWebSocketHandler extends TextWebSocketHandler implements ExecutionEventListener {

    private static final Logger log = LoggerFactory.getLogger(ExecutionWebSocketHandler.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final ExecutionEventPublisher eventPublisher;
    private final Map<String, WebSocketSession> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<WebSocketSession>> executionSubscriptions = new ConcurrentHashMap<>();
    private final Set<WebSocketSession> allSubscribers = new CopyOnWriteArraySet<>();

    public ExecutionWebSocketHandler(ObjectMapper objectMapper, ExecutionEventPublisher eventPublisher) {
        this.objectMapper = objectMapper;
        this.eventPublisher = eventPublisher;
    }

    @PostConstruct
    public void init() {
        eventPublisher.addListener(this);
    }

    @PreDestroy
    public void destroy() {
        eventPublisher.removeListener(this);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        connection(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketSession connection = connections.remove(session.getId());
        if (connection == null) return;
        allSubscribers.remove(connection);
        executionSubscriptions.keySet().forEach(id -> unsubscribe(id, connection));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        WebSocketSession connection = connection(session);
        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (IOException e) {
            send(connection, error(null, "Malformed message"));
            return;
        }
        String type = node.path("type").asText();
        String executionId = node.hasNonNull("executionId") ? node.get("executionId").asText() : null;

        switch (type) {
            case "SUBSCRIBE_EXECUTION" -> {
                if (executionId == null || executionId.isBlank()) {
                    send(connection, error(null, "executionId is required"));
                    return;
                }
                executionSubscriptions.compute(executionId, (id, set) -> {
                    Set<WebSocketSession> subscribers = set != null ? set : new CopyOnWriteArraySet<>();
                    subscribers.add(connection);
                    return subscribers;
                });
                send(connection, WsMessage.of(WsMessageType.SUBSCRIBED, executionId, null));
            }
            case "SUBSCRIBE_ALL" -> {
                allSubscribers.add(connection);
                send(connection, WsMessage.of(WsMessageType.SUBSCRIBED, null, null));
            }
            case "UNSUBSCRIBE" -> {
                if (executionId == null) {
                    allSubscribers.remove(connection);
                    executionSubscriptions.keySet().forEach(id -> unsubscribe(id, connection));
                } else {
                    unsubscribe(executionId, connection);
                }
                send(connection, WsMessage.of(WsMessageType.UNSUBSCRIBED, executionId, null));
            }
            default -> send(connection, error(executionId, "Unknown message type: " + type));
        }
    }

    @Override
    public void onEvent(ExecutionEvent event) {
        Set<WebSocketSession> targets = new LinkedHashSet<>(allSubscribers);
        Set<WebSocketSession> followers = executionSubscriptions.get(event.executionId());
        if (followers != null) targets.addAll(followers);
        if (targets.isEmpty()) return;

        ObjectNode payload = objectMapper.createObjectNode();
        WsMessageType type;
        if (event.type() == ExecutionEventType.STATUS_CHANGED) {
            type = WsMessageType.STATUS_CHANGED;
            payload.put("status", event.status() != null ? event.status().name() : null);
        } else {
            type = WsMessageType.OUTPUT_APPENDED;
            payload.put("chunk", event.chunk());
        }
        TextMessage text;
        try {
            text = new TextMessage(objectMapper.writeValueAsString(
                    new WsMessage(type, event.executionId(), payload, event.timestamp())));
        } catch (IOException e) {
            log.error("Could not serialise {} event of execution {}", event.type(), event.executionId(), e);
            return;
        }
        for (WebSocketSession ws : targets) {
            if (ws.isOpen()) {
                try {
                    ws.sendMessage(text);
                } catch (IOException | IllegalStateException e) {
                    log.debug("Dropping event for WebSocket {}: {}", ws.getId(), e.getMessage());
                }
            }
        }
    }

    @Override
    public void onError(Throwable t) {
        log.error("Execution event delivery error in WebSocket handler", t);
    }

    private void unsubscribe(String executionId, WebSocketSession connection) {
        executionSubscriptions.computeIfPresent(executionId, (id, set) -> {
            set.remove(connection);
            return set.isEmpty() ? null : set;
        });
    }

    private WebSocketSession connection(WebSocketSession session) {
        return connections.computeIfAbsent(session.getId(),
                id -> new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
    }

    private WsMessage error(String executionId, String message) {
        return WsMessage.error(executionId, objectMapper.createObjectNode().put("message", message));
    }

    private void send(WebSocketSession session, WsMessage message) throws IOException {
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
    }
}
