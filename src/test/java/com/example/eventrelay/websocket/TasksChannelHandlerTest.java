package com.example.eventrelay.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class TasksChannelHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ConnectionRegistry registry;
    private TaskScheduler scheduler;
    private ScheduledFuture<?> heartbeatFuture;
    private Runnable heartbeat;
    private TasksChannelHandler handler;
    private List<String> frames;
    private WebSocketSession session;
    private String connectionId;

    @BeforeEach
    public void setup() throws Exception {
        registry = new ConnectionRegistry(objectMapper);
        scheduler = mock(TaskScheduler.class);
        heartbeatFuture = mock(ScheduledFuture.class);
        when(scheduler.scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class)))
                .thenAnswer(invocation -> {
                    heartbeat = invocation.getArgument(0);
                    return heartbeatFuture;
                });
        handler = new TasksChannelHandler(registry, scheduler, objectMapper, 30000, 256);

        frames = new CopyOnWriteArrayList<>();
        session = RecordingSessions.open("s1", frames);
        handler.afterConnectionEstablished(session);
        connectionId = (String) session.getAttributes().get(EntityChannelHandler.CONNECTION_ID_ATTR);
    }

    private JsonNode lastFrame() throws Exception {
        return objectMapper.readTree(frames.get(frames.size() - 1));
    }

    @Test
    public void testConnectedFrameAndChannelMembership() throws Exception {
        assertNotNull(connectionId);
        assertEquals(1, frames.size());
        JsonNode connected = lastFrame();
        assertEquals("connected", connected.get("type").asText());
        assertEquals("tasks", connected.get("channel").asText());
        assertEquals(connectionId, connected.get("connectionId").asText());
        assertTrue(connected.hasNonNull("timestamp"));

        assertEquals(Set.of("tasks"), registry.channelsOf(connectionId));
        assertEquals(1, handler.activeHeartbeats());
    }

    @Test
    public void testSubscribeAndUnsubscribe() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"subscribe\",\"taskId\":\"42\"}"));

        assertEquals("subscribed", lastFrame().get("type").asText());
        assertEquals("42", lastFrame().get("taskId").asText());
        assertEquals(Set.of("tasks", "task:42"), registry.channelsOf(connectionId));

        handler.handleTextMessage(session, new TextMessage("{\"type\":\"subscribe\",\"entityId\":7}"));
        assertEquals("7", lastFrame().get("taskId").asText());
        assertTrue(registry.channelsOf(connectionId).contains("task:7"));

        handler.handleTextMessage(session, new TextMessage("{\"type\":\"unsubscribe\",\"taskId\":\"42\"}"));

        assertEquals("unsubscribed", lastFrame().get("type").asText());
        assertEquals(Set.of("tasks", "task:7"), registry.channelsOf(connectionId));
    }

    @Test
    public void testPongIsSilent() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"pong\"}"));

        assertEquals(1, frames.size());
    }

    @Test
    public void testOtherMessagesAreEchoed() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"hello\",\"n\":1}"));

        JsonNode echo = lastFrame();
        assertEquals("echo", echo.get("type").asText());
        assertEquals("hello", echo.get("data").get("type").asText());
        assertEquals(1, echo.get("data").get("n").asInt());
    }

    @Test
    public void testSubscribeWithoutIdIsEchoed() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"subscribe\"}"));

        assertEquals("echo", lastFrame().get("type").asText());
        assertEquals(Set.of("tasks"), registry.channelsOf(connectionId));
    }

    @Test
    public void testMalformedAndOversizedMessages() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{not json"));
        assertEquals("error", lastFrame().get("type").asText());
        assertEquals("Failed to process message", lastFrame().get("message").asText());

        handler.handleTextMessage(session, new TextMessage("{\"type\":\"x\",\"pad\":\"" + "a".repeat(300) + "\"}"));
        assertEquals("error", lastFrame().get("type").asText());

        assertTrue(registry.isConnected(connectionId));
    }

    @Test
    public void testBroadcastReachesSubscribedConnection() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"subscribe\",\"taskId\":\"42\"}"));

        assertEquals(1, registry.broadcast("task:42", "{\"type\":\"task.updated\"}"));
        assertEquals(0, registry.broadcast("product:42", "{}"));
        assertEquals("task.updated", lastFrame().get("type").asText());
    }

    @Test
    public void testHeartbeatSendsPing() throws Exception {
        assertNotNull(heartbeat);

        heartbeat.run();

        assertEquals("ping", lastFrame().get("type").asText());
        verify(heartbeatFuture, never()).cancel(anyBoolean());
    }

    @Test
    public void testHeartbeatStopsWhenConnectionGone() {
        registry.removeConnection(connectionId);

        heartbeat.run();

        verify(heartbeatFuture).cancel(false);
        assertEquals(0, handler.activeHeartbeats());
    }

    @Test
    public void testCloseDeregistersAndStopsHeartbeat() throws Exception {
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertFalse(registry.isConnected(connectionId));
        assertTrue(registry.getStats().channels().isEmpty());
        assertEquals(0, handler.activeHeartbeats());
        verify(heartbeatFuture).cancel(false);

        assertDoesNotThrow(() -> handler.afterConnectionClosed(session, CloseStatus.NORMAL));
    }
}
