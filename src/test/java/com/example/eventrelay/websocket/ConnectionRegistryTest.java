package com.example.eventrelay.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

public class ConnectionRegistryTest {

    private ConnectionRegistry registry;

    @BeforeEach
    public void setup() {
        registry = new ConnectionRegistry(new ObjectMapper());
    }

    @Test
    public void testBroadcastOnlyReachesChannelMembers() {
        FakeConnectionHandle tasks = new FakeConnectionHandle();
        FakeConnectionHandle products = new FakeConnectionHandle();
        registry.addConnection("c1", tasks, null);
        registry.addConnection("c2", products, null);
        registry.joinChannel("c1", "tasks");
        registry.joinChannel("c2", "products");

        int delivered = registry.broadcast("tasks", Map.of("type", "task.created"));

        assertEquals(1, delivered);
        assertEquals(List.of("{\"type\":\"task.created\"}"), tasks.sent());
        assertTrue(products.sent().isEmpty());
    }

    @Test
    public void testJoinRacingLastLeaveKeepsMembership() throws Exception {
        FakeConnectionHandle leaver = new FakeConnectionHandle();
        FakeConnectionHandle joiner = new FakeConnectionHandle();
        registry.addConnection("a", leaver, null);
        registry.addConnection("b", joiner, null);

        for (int round = 0; round < 2000; round++) {
            String channel = "task:" + round;
            registry.joinChannel("a", channel);
            CountDownLatch start = new CountDownLatch(1);
            Thread leave = new Thread(() -> {
                awaitQuietly(start);
                registry.leaveChannel("a", channel);
            });
            Thread join = new Thread(() -> {
                awaitQuietly(start);
                registry.joinChannel("b", channel);
            });
            leave.start();
            join.start();
            start.countDown();
            leave.join();
            join.join();

            assertTrue(registry.channelsOf("b").contains(channel));
            assertEquals(1, registry.broadcast(channel, "ping"), "round " + round);
            registry.leaveChannel("b", channel);
        }
        assertTrue(registry.getStats().channels().isEmpty());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    public void testFailingConnectionIsRemovedAndOthersStillReceive() {
        FakeConnectionHandle broken = new FakeConnectionHandle().failing();
        FakeConnectionHandle healthy = new FakeConnectionHandle();
        registry.addConnection("bad", broken, "u1");
        registry.addConnection("good", healthy, null);
        registry.joinChannel("bad", "tasks");
        registry.joinChannel("good", "tasks");

        assertEquals(1, registry.broadcast("tasks", "hello"));

        assertEquals(List.of("hello"), healthy.sent());
        assertFalse(registry.isConnected("bad"));
        assertEquals(1, registry.connectionCount());
        assertEquals(0, registry.getStats().totalUsers());
    }

    @Test
    public void testClosedHandleCountsAsDead() {
        FakeConnectionHandle handle = new FakeConnectionHandle();
        registry.addConnection("c1", handle, null);
        registry.joinChannel("c1", "posts");
        handle.close();

        assertEquals(0, registry.broadcast("posts", "x"));
        assertFalse(registry.isConnected("c1"));
    }

    @Test
    public void testEmptyChannelsAreRemoved() {
        registry.addConnection("c1", new FakeConnectionHandle(), null);
        registry.addConnection("c2", new FakeConnectionHandle(), null);
        registry.joinChannel("c1", "task:1");
        registry.joinChannel("c2", "task:1");
        registry.joinChannel("c1", "tasks");

        registry.leaveChannel("c1", "task:1");
        assertEquals(List.of(new RegistryStats.ChannelStat("task:1", 1), new RegistryStats.ChannelStat("tasks", 1)),
                registry.getStats().channels());

        registry.removeConnection("c2");
        registry.removeConnection("c1");

        RegistryStats stats = registry.getStats();
        assertEquals(0, stats.totalConnections());
        assertTrue(stats.channels().isEmpty());
    }

    @Test
    public void testUnknownConnectionCannotJoin() {
        assertFalse(registry.joinChannel("ghost", "tasks"));
        assertFalse(registry.leaveChannel("ghost", "tasks"));
        assertFalse(registry.sendToConnection("ghost", "x"));
        assertEquals(0, registry.broadcast("tasks", "x"));
        assertEquals(Set.of(), registry.channelsOf("ghost"));
    }

    @Test
    public void testSendToUserReachesAllOfTheirConnections() {
        FakeConnectionHandle a = new FakeConnectionHandle();
        FakeConnectionHandle b = new FakeConnectionHandle();
        FakeConnectionHandle other = new FakeConnectionHandle();
        registry.addConnection("a", a, "alice");
        registry.addConnection("b", b, "alice");
        registry.addConnection("o", other, "bob");

        assertEquals(2, registry.sendToUser("alice", "hi"));
        assertEquals(List.of("hi"), a.sent());
        assertEquals(List.of("hi"), b.sent());
        assertTrue(other.sent().isEmpty());
        assertEquals(2, registry.getStats().totalUsers());
    }

    @Test
    public void testRemoveConnectionCascadesAndIsIdempotent() {
        registry.addConnection("c1", new FakeConnectionHandle(), "alice");
        registry.joinChannel("c1", "tasks");
        registry.joinChannel("c1", "task:9");

        assertEquals(Set.of("tasks", "task:9"), registry.channelsOf("c1"));

        registry.removeConnection("c1");
        registry.removeConnection("c1");

        assertEquals(0, registry.connectionCount());
        assertEquals(0, registry.broadcast("tasks", "x"));
        assertEquals(0, registry.sendToUser("alice", "x"));
    }

    @Test
    public void testCloseAll() {
        FakeConnectionHandle handle = new FakeConnectionHandle();
        registry.addConnection("c1", handle, null);

        registry.closeAll();

        assertFalse(handle.isOpen());
        assertEquals(0, registry.connectionCount());
    }
}
