package com.example.eventrelay.websocket;

import com.example.eventrelay.model.EntityType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * 实体频道 WebSocket 处理器基类
 * 将客户端的 subscribe/unsubscribe/pong 消息转换为注册表操作，并定期发送心跳。
 * <p>
 * 连接建立时加入实体类型频道（如 tasks），subscribe 加入细粒度频道（如 task:42）。
 */
@Slf4j
public abstract class EntityChannelHandler extends TextWebSocketHandler {

    static final String CONNECTION_ID_ATTR = "connectionId";

    private final EntityType entityType;
    private final ConnectionRegistry registry;
    private final TaskScheduler scheduler;
    private final ObjectMapper objectMapper;
    private final Duration heartbeatInterval;
    private final int maxMessageLength;

    // 键：connectionId
    private final Map<String, ScheduledFuture<?>> heartbeats = new ConcurrentHashMap<>();

    protected EntityChannelHandler(EntityType entityType, ConnectionRegistry registry, TaskScheduler scheduler,
            ObjectMapper objectMapper, Duration heartbeatInterval, int maxMessageLength) {
        this.entityType = entityType;
        this.registry = registry;
        this.scheduler = scheduler;
        this.objectMapper = objectMapper;
        this.heartbeatInterval = heartbeatInterval;
        this.maxMessageLength = maxMessageLength;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String connectionId = UUID.randomUUID().toString();
        session.getAttributes().put(CONNECTION_ID_ATTR, connectionId);
        String userId = (String) session.getAttributes().get(IdentityHandshakeInterceptor.USER_ID_ATTR);

        registry.addConnection(connectionId, new WebSocketConnectionHandle(session), userId);
        registry.joinChannel(connectionId, entityType.channel());
        log.info("[{}Channel] Connection opened: {}{}", entityType.singular(), connectionId,
                userId != null ? " (user: " + userId + ")" : "");

        Map<String, Object> welcome = frame("connected");
        welcome.put("channel", entityType.channel());
        welcome.put("connectionId", connectionId);
        registry.sendToConnection(connectionId, welcome);

        startHeartbeat(connectionId);
    }

    private void startHeartbeat(String connectionId) {
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> {
            // 注册表中已不存在（或发送失败被移除）时停止心跳
            if (!registry.isConnected(connectionId) || !registry.sendToConnection(connectionId, frame("ping"))) {
                stopHeartbeat(connectionId);
                return;
            }
            log.debug("[{}Channel] Heartbeat sent to {}", entityType.singular(), connectionId);
        }, Instant.now().plus(heartbeatInterval), heartbeatInterval);
        heartbeats.put(connectionId, future);
    }

    private void stopHeartbeat(String connectionId) {
        ScheduledFuture<?> future = heartbeats.remove(connectionId);
        if (future != null) {
            future.cancel(false);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        String connectionId = connectionId(session);
        String payload = message.getPayload();

        try {
            if (payload.length() > maxMessageLength) {
                throw new IllegalArgumentException("Message too large: " + payload.length());
            }
            JsonNode data = objectMapper.readTree(payload);
            if (data == null || !data.isObject()) {
                throw new IllegalArgumentException("Message must be a JSON object");
            }
            String type = data.path("type").asText("");
            String entityId = entityIdOf(data);

            if ("pong".equals(type)) {
                return;
            }

            if ("subscribe".equals(type) && entityId != null) {
                registry.joinChannel(connectionId, entityType.entityChannel(entityId));
                Map<String, Object> reply = frame("subscribed");
                reply.put(entityType.idParameter(), entityId);
                registry.sendToConnection(connectionId, reply);
                return;
            }

            if ("unsubscribe".equals(type) && entityId != null) {
                registry.leaveChannel(connectionId, entityType.entityChannel(entityId));
                Map<String, Object> reply = frame("unsubscribed");
                reply.put(entityType.idParameter(), entityId);
                registry.sendToConnection(connectionId, reply);
                return;
            }

            Map<String, Object> echo = frame("echo");
            echo.put("data", data);
            registry.sendToConnection(connectionId, echo);
        } catch (Exception e) {
            log.warn("[{}Channel] Failed to process message from {}: {}", entityType.singular(), connectionId,
                    e.getMessage());
            Map<String, Object> error = frame("error");
            error.put("message", "Failed to process message");
            registry.sendToConnection(connectionId, error);
        }
    }

    private String entityIdOf(JsonNode data) {
        JsonNode id = data.get(entityType.idParameter());
        if (id == null || id.isNull()) {
            id = data.get("entityId");
        }
        if (id == null || id.isNull() || !id.isValueNode()) {
            return null;
        }
        String text = id.asText();
        return text.isEmpty() ? null : text;
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        String connectionId = connectionId(session);
        if (connectionId == null) {
            return;
        }
        stopHeartbeat(connectionId);
        registry.removeConnection(connectionId);
        log.info("[{}Channel] Connection closed: {}, status: {}", entityType.singular(), connectionId, status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        String connectionId = connectionId(session);
        log.error("[{}Channel] Transport error on connection {}", entityType.singular(), connectionId, exception);
        if (connectionId != null) {
            stopHeartbeat(connectionId);
            registry.removeConnection(connectionId);
        }
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    public EntityType getEntityType() {
        return entityType;
    }

    int activeHeartbeats() {
        return heartbeats.size();
    }

    private static String connectionId(WebSocketSession session) {
        return (String) session.getAttributes().get(CONNECTION_ID_ATTR);
    }

    private static Map<String, Object> frame(String type) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", type);
        frame.put("timestamp", Instant.now().toString());
        return frame;
    }
}
