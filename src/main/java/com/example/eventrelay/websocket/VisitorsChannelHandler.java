package com.example.eventrelay.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 访客在线人数频道（/ws/visitors），匿名连接，人数变化时向所有访客广播。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VisitorsChannelHandler extends TextWebSocketHandler {

    static final String CHANNEL = "visitors";

    private final ConnectionRegistry registry;
    private final ObjectMapper objectMapper;

    private final Set<String> activeVisitors = ConcurrentHashMap.newKeySet();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String connectionId = UUID.randomUUID().toString();
        session.getAttributes().put(EntityChannelHandler.CONNECTION_ID_ATTR, connectionId);

        registry.addConnection(connectionId, new WebSocketConnectionHandle(session), null);
        registry.joinChannel(connectionId, CHANNEL);
        activeVisitors.add(connectionId);
        log.info("[VisitorsChannel] Client connected: {}", connectionId);

        broadcastCount();
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connectionId = (String) session.getAttributes().get(EntityChannelHandler.CONNECTION_ID_ATTR);
        try {
            JsonNode data = objectMapper.readTree(message.getPayload());
            String type = data.path("type").asText("");
            switch (type) {
                case "ping" -> {
                    Map<String, Object> pong = new LinkedHashMap<>();
                    pong.put("type", "pong");
                    pong.put("timestamp", System.currentTimeMillis());
                    registry.sendToConnection(connectionId, pong);
                }
                case "request_count" -> registry.sendToConnection(connectionId, countMessage());
                default -> log.debug("[VisitorsChannel] Unknown message type: {}", type);
            }
        } catch (Exception e) {
            log.warn("[VisitorsChannel] Error processing message from {}: {}", connectionId, e.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connectionId = (String) session.getAttributes().get(EntityChannelHandler.CONNECTION_ID_ATTR);
        if (connectionId == null) {
            return;
        }
        activeVisitors.remove(connectionId);
        registry.removeConnection(connectionId);
        log.info("[VisitorsChannel] Client disconnected: {}", connectionId);
        broadcastCount();
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        String connectionId = (String) session.getAttributes().get(EntityChannelHandler.CONNECTION_ID_ATTR);
        log.error("[VisitorsChannel] Transport error on connection {}", connectionId, exception);
        if (connectionId != null) {
            activeVisitors.remove(connectionId);
            registry.removeConnection(connectionId);
        }
    }

    public int getVisitorCount() {
        return activeVisitors.size();
    }

    private void broadcastCount() {
        registry.broadcast(CHANNEL, countMessage());
    }

    private Map<String, Object> countMessage() {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "visitor_count");
        message.put("count", activeVisitors.size());
        message.put("timestamp", System.currentTimeMillis());
        return message;
    }
}
