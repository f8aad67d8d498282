package com.example.eventrelay.service.bus;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private static final Duration WAIT = Duration.ofMillis(200);

    private final EventBus bus = new EventBus();

    @Test
    void everySubscriberReceivesEachMessageInPublishOrder() throws Exception {
        EventStream<BusMessage> first = bus.subscribe(List.of("TASK_CREATED"));
        EventStream<BusMessage> second = bus.subscribe(List.of("TASK_CREATED"));

        for (int i = 0; i < 5; i++) {
            bus.publish("TASK_CREATED", i);
        }

        for (EventStream<BusMessage> stream : List.of(first, second)) {
            List<Object> received = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                received.add(stream.poll(WAIT).payload());
            }
            assertEquals(List.of(0, 1, 2, 3, 4), received);
            assertNull(stream.poll(Duration.ofMillis(20)));
        }
    }

    @Test
    void noReplayOfMessagesPublishedBeforeSubscribe() throws Exception {
        bus.publish("TASK_CREATED", "early");
        EventStream<BusMessage> stream = bus.subscribe(List.of("TASK_CREATED"));
        bus.publish("TASK_CREATED", "late");

        assertEquals("late", stream.poll(WAIT).payload());
        assertNull(stream.poll(Duration.ofMillis(20)));
    }

    @Test
    void onlySubscribedTopicsAreDelivered() throws Exception {
        EventStream<BusMessage> stream = bus.subscribe(List.of("TASK_CREATED", "TASK_DELETED"));
        bus.publish("PRODUCT_CREATED", "p");
        bus.publish("TASK_DELETED", "t");

        BusMessage message = stream.poll(WAIT);
        assertEquals("TASK_DELETED", message.topic());
        assertEquals("t", message.payload());
        assertNull(stream.poll(Duration.ofMillis(20)));
    }

    @Test
    void closedStreamReceivesNothingAndPublishDoesNotThrow() throws Exception {
        EventStream<BusMessage> stream = bus.subscribe(List.of("POST_UPDATED"));
        stream.close();
        stream.close();

        assertDoesNotThrow(() -> bus.publish("POST_UPDATED", "after close"));
        assertTrue(stream.isClosed());
        assertNull(stream.poll(WAIT));
        assertNull(stream.next());
        assertEquals(0, bus.subscriberCount("POST_UPDATED"));
    }

    @Test
    void closeWakesBlockedConsumer() throws Exception {
        EventStream<BusMessage> stream = bus.subscribe(List.of("TASK_UPDATED"));
        CountDownLatch done = new CountDownLatch(1);
        Thread consumer = new Thread(() -> {
            try {
                assertNull(stream.next());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        consumer.start();

        Thread.sleep(50);
        stream.close();
        assertTrue(done.await(1, TimeUnit.SECONDS));
    }

    @Test
    void shutdownClosesAllStreams() {
        EventStream<BusMessage> a = bus.subscribe(List.of("TASK_CREATED"));
        EventStream<BusMessage> b = bus.subscribe(List.of("PRODUCT_CREATED", "TASK_CREATED"));

        bus.shutdown();

        assertTrue(a.isClosed());
        assertTrue(b.isClosed());
        assertEquals(0, bus.subscriberCount("TASK_CREATED"));
    }

    @Test
    void subscribeRequiresTopics() {
        assertThrows(IllegalArgumentException.class, () -> bus.subscribe(List.of()));
    }
}
