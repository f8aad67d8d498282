package com.example.eventrelay.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class WebhookEventTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);

    @Test
    void testPendingIsDueImmediately() {
        WebhookEvent event = WebhookEvent.pending(1L, "task.created", "{}", NOW);

        assertEquals(DeliveryStatus.PENDING, event.getStatus());
        assertEquals(0, event.getAttempts());
        assertTrue(event.isDue(NOW));
        assertFalse(event.isDue(NOW.minusSeconds(1)));
    }

    @Test
    void testRetryThenDeliver() {
        WebhookEvent event = WebhookEvent.pending(1L, "task.created", "{}", NOW);

        event.scheduleRetry(500, "oops", "HTTP 500", NOW, NOW.plusMinutes(5));
        assertEquals(1, event.getAttempts());
        assertEquals(DeliveryStatus.PENDING, event.getStatus());
        assertFalse(event.isDue(NOW.plusMinutes(4)));
        assertTrue(event.isDue(NOW.plusMinutes(5)));

        event.markDelivered(200, "ok", NOW.plusMinutes(5));
        assertEquals(2, event.getAttempts());
        assertEquals(DeliveryStatus.DELIVERED, event.getStatus());
        assertNull(event.getNextRetry());
        assertNull(event.getErrorMessage());
        assertFalse(event.isDue(NOW.plusDays(1)));
    }

    @Test
    void testTerminalStatesAreFinal() {
        WebhookEvent failed = WebhookEvent.pending(1L, "task.created", "{}", NOW);
        failed.markFailed(null, null, "Network error: refused", NOW);

        assertEquals(DeliveryStatus.FAILED, failed.getStatus());
        assertThrows(IllegalStateException.class, () -> failed.markDelivered(200, "", NOW));
        assertThrows(IllegalStateException.class, () -> failed.scheduleRetry(500, "", "x", NOW, NOW));
        assertThrows(IllegalStateException.class, () -> failed.makeDue(NOW));
        assertEquals(1, failed.getAttempts());

        WebhookEvent delivered = WebhookEvent.pending(1L, "task.created", "{}", NOW);
        delivered.markDelivered(204, "", NOW);
        assertThrows(IllegalStateException.class, () -> delivered.markFailed(500, "", "x", NOW));
        assertEquals(DeliveryStatus.DELIVERED, delivered.getStatus());
    }

    @Test
    void testMakeDuePullsRetryForward() {
        WebhookEvent event = WebhookEvent.pending(1L, "task.created", "{}", NOW);
        event.scheduleRetry(503, "", "HTTP 503", NOW, NOW.plusHours(6));

        event.makeDue(NOW.plusMinutes(1));

        assertTrue(event.isDue(NOW.plusMinutes(1)));
        assertEquals(1, event.getAttempts());
    }
}
