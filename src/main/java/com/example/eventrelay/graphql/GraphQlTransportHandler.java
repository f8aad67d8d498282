package com.example.eventrelay.graphql;

import com.example.eventrelay.security.Identity;
import com.example.eventrelay.security.IdentityResolver;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import graphql.ExecutionInput;
import graphql.ExecutionResult;
import graphql.GraphQL;
import graphql.GraphQLError;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Publisher;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.SubProtocolCapable;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * graphql-transport-ws 协议处理器
 * <p>
 * 单个连接上复用多个具名订阅：subscribe 执行订阅查询并按 id 保存结果流，
 * 每个结果发送 next，流结束发送 complete，出错发送 error；
 * 客户端 complete 或连接关闭时终止对应的流。格式错误的帧只返回连接级 error，不关闭连接。
 */
@Component
@Slf4j
public class GraphQlTransportHandler extends TextWebSocketHandler implements SubProtocolCapable {

    static final String SUB_PROTOCOL = "graphql-transport-ws";
    static final String IDENTITY_CONTEXT_KEY = "identity";

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final GraphQL graphQL;
    private final IdentityResolver identityResolver;
    private final ObjectMapper objectMapper;

    // 键：WebSocket sessionId
    private final Map<String, ConnectionState> connections = new ConcurrentHashMap<>();

    public GraphQlTransportHandler(GraphQL graphQL, IdentityResolver identityResolver, ObjectMapper objectMapper) {
        this.graphQL = graphQL;
        this.identityResolver = identityResolver;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<String> getSubProtocols() {
        return List.of(SUB_PROTOCOL);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS,
                BUFFER_SIZE_LIMIT);
        connections.put(session.getId(), new ConnectionState(concurrent));
        log.info("[GraphQlWs] Connection opened: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ConnectionState state = connections.get(session.getId());
        if (state == null) {
            return;
        }

        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            sendError(state, null, "Invalid message: " + e.getOriginalMessage());
            return;
        }
        if (frame == null || !frame.isObject() || !frame.path("type").isTextual()) {
            sendError(state, null, "Invalid message: missing type");
            return;
        }

        String type = frame.get("type").asText();
        log.debug("[GraphQlWs] {} <- {}", session.getId(), type);
        switch (type) {
            case "connection_init" -> handleConnectionInit(state, frame.get("payload"));
            case "ping" -> {
                Map<String, Object> pong = new LinkedHashMap<>();
                pong.put("type", "pong");
                if (frame.hasNonNull("payload")) {
                    pong.put("payload", frame.get("payload"));
                }
                send(state, pong);
            }
            case "pong" -> {
                // keep-alive reply, nothing to do
            }
            case "subscribe" -> handleSubscribe(state, frame);
            case "complete" -> handleComplete(state, frame);
            default -> sendError(state, null, "Unknown message type: " + type);
        }
    }

    private void handleConnectionInit(ConnectionState state, JsonNode payload) {
        // 重复的 connection_init 按幂等处理，以最后一次解析结果为准
        JsonNode authorization = payload == null ? null : payload.get("authorization");
        state.identity = authorization != null && authorization.isTextual()
                ? identityResolver.resolve(authorization.asText()).orElse(null)
                : null;
        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("type", "connection_ack");
        send(state, ack);
    }

    private void handleSubscribe(ConnectionState state, JsonNode frame) {
        JsonNode idNode = frame.get("id");
        if (idNode == null || !idNode.isTextual() || idNode.asText().isEmpty()) {
            sendError(state, null, "Invalid subscribe message: missing id");
            return;
        }
        String id = idNode.asText();
        JsonNode payload = frame.get("payload");
        if (payload == null || !payload.path("query").isTextual()) {
            sendError(state, null, "Invalid subscribe message: missing query");
            return;
        }
        if (state.subscriptions.containsKey(id)) {
            sendError(state, id, "Subscriber for " + id + " already exists");
            return;
        }

        ExecutionResult result;
        try {
            result = graphQL.execute(executionInput(state, payload));
        } catch (RuntimeException e) {
            log.error("[GraphQlWs] Subscribe error for {}", id, e);
            sendError(state, id, e.getMessage() != null ? e.getMessage() : "Unknown error");
            return;
        }

        if (!result.getErrors().isEmpty()) {
            sendErrors(state, id, result.getErrors());
            return;
        }
        Object data = result.getData();
        if (!(data instanceof Publisher)) {
            sendError(state, id, "Expected subscription to return a publisher");
            return;
        }

        @SuppressWarnings("unchecked")
        Publisher<ExecutionResult> publisher = (Publisher<ExecutionResult>) data;
        Disposable.Swap slot = Disposables.swap();
        state.subscriptions.put(id, slot);
        log.debug("[GraphQlWs] Subscription {} started on {}", id, state.session.getId());

        Disposable disposable = Flux.from(publisher).subscribe(
                next -> {
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("type", "next");
                    out.put("id", id);
                    out.put("payload", next.toSpecification());
                    send(state, out);
                },
                error -> {
                    log.warn("[GraphQlWs] Subscription {} error: {}", id, error.getMessage());
                    if (state.subscriptions.remove(id, slot)) {
                        sendError(state, id, error.getMessage() != null ? error.getMessage() : "Unknown error");
                    }
                },
                () -> {
                    if (state.subscriptions.remove(id, slot)) {
                        Map<String, Object> complete = new LinkedHashMap<>();
                        complete.put("type", "complete");
                        complete.put("id", id);
                        send(state, complete);
                    }
                });
        slot.update(disposable);
    }

    private ExecutionInput executionInput(ConnectionState state, JsonNode payload) {
        Map<String, Object> variables = new HashMap<>();
        if (payload.hasNonNull("variables") && payload.get("variables").isObject()) {
            variables = objectMapper.convertValue(payload.get("variables"), new TypeReference<Map<String, Object>>() {
            });
        }
        Map<String, Object> context = new HashMap<>();
        if (state.identity != null) {
            context.put(IDENTITY_CONTEXT_KEY, state.identity);
        }
        ExecutionInput.Builder input = ExecutionInput.newExecutionInput()
                .query(payload.get("query").asText())
                .variables(variables)
                .graphQLContext(context);
        if (payload.hasNonNull("operationName")) {
            input.operationName(payload.get("operationName").asText());
        }
        return input.build();
    }

    private void handleComplete(ConnectionState state, JsonNode frame) {
        JsonNode idNode = frame.get("id");
        if (idNode == null || !idNode.isTextual()) {
            sendError(state, null, "Invalid complete message: missing id");
            return;
        }
        Disposable subscription = state.subscriptions.remove(idNode.asText());
        if (subscription != null) {
            subscription.dispose();
            log.debug("[GraphQlWs] Subscription {} completed by client", idNode.asText());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ConnectionState state = connections.remove(session.getId());
        if (state != null) {
            state.disposeAll();
            log.info("[GraphQlWs] Connection closed: {}, status: {}", session.getId(), status);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.error("[GraphQlWs] Transport error on {}", session.getId(), exception);
        ConnectionState state = connections.remove(session.getId());
        if (state != null) {
            state.disposeAll();
        }
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    int activeSubscriptions(String sessionId) {
        ConnectionState state = connections.get(sessionId);
        return state == null ? 0 : state.subscriptions.size();
    }

    private void sendErrors(ConnectionState state, String id, List<GraphQLError> errors) {
        List<Map<String, Object>> payload = new ArrayList<>();
        for (GraphQLError error : errors) {
            payload.add(error.toSpecification());
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", "error");
        out.put("id", id);
        out.put("payload", payload);
        send(state, out);
    }

    private void sendError(ConnectionState state, String id, String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", "error");
        if (id != null) {
            out.put("id", id);
        }
        out.put("payload", List.of(Map.of("message", message)));
        send(state, out);
    }

    private void send(ConnectionState state, Map<String, Object> frame) {
        try {
            if (state.session.isOpen()) {
                state.session.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
            }
        } catch (IOException | RuntimeException e) {
            log.warn("[GraphQlWs] Send to {} failed: {}", state.session.getId(), e.getMessage());
        }
    }

    private static final class ConnectionState {

        private final WebSocketSession session;
        private final Map<String, Disposable> subscriptions = new ConcurrentHashMap<>();
        private volatile Identity identity;

        ConnectionState(WebSocketSession session) {
            this.session = session;
        }

        void disposeAll() {
            subscriptions.values().forEach(Disposable::dispose);
            subscriptions.clear();
        }
    }
}
