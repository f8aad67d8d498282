package com.example.eventrelay.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

public class VisitorsChannelHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private VisitorsChannelHandler handler;

    @BeforeEach
    public void setup() {
        handler = new VisitorsChannelHandler(new ConnectionRegistry(objectMapper), objectMapper);
    }

    private JsonNode last(List<String> frames) throws Exception {
        return objectMapper.readTree(frames.get(frames.size() - 1));
    }

    @Test
    public void testCountBroadcastOnJoinAndLeave() throws Exception {
        List<String> first = new CopyOnWriteArrayList<>();
        List<String> second = new CopyOnWriteArrayList<>();
        WebSocketSession a = RecordingSessions.open("a", first);
        WebSocketSession b = RecordingSessions.open("b", second);

        handler.afterConnectionEstablished(a);
        assertEquals(1, last(first).get("count").asInt());

        handler.afterConnectionEstablished(b);
        assertEquals("visitor_count", last(first).get("type").asText());
        assertEquals(2, last(first).get("count").asInt());
        assertEquals(2, last(second).get("count").asInt());

        handler.afterConnectionClosed(b, CloseStatus.NORMAL);
        assertEquals(1, last(first).get("count").asInt());
        assertEquals(1, handler.getVisitorCount());
    }

    @Test
    public void testPingAndRequestCount() throws Exception {
        List<String> frames = new CopyOnWriteArrayList<>();
        WebSocketSession session = RecordingSessions.open("a", frames);
        handler.afterConnectionEstablished(session);

        handler.handleTextMessage(session, new TextMessage("{\"type\":\"ping\"}"));
        assertEquals("pong", last(frames).get("type").asText());

        handler.handleTextMessage(session, new TextMessage("{\"type\":\"request_count\"}"));
        assertEquals("visitor_count", last(frames).get("type").asText());
        assertEquals(1, last(frames).get("count").asInt());

        int before = frames.size();
        handler.handleTextMessage(session, new TextMessage("garbage"));
        assertEquals(before, frames.size());
    }
}
