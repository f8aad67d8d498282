package com.example.eventrelay.service;

import com.example.eventrelay.model.DomainEvent;
import com.example.eventrelay.model.EntityType;
import com.example.eventrelay.model.EventAction;
import com.example.eventrelay.service.bus.EventBus;
import com.example.eventrelay.service.webhook.WebhookEventEmitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class DomainEventPublisherTest {

    private EventBus eventBus;
    private WebhookEventEmitter emitter;
    private DomainEventPublisher publisher;

    @BeforeEach
    public void setup() {
        eventBus = mock(EventBus.class);
        emitter = mock(WebhookEventEmitter.class);
        publisher = new DomainEventPublisher(eventBus, emitter);
    }

    @Test
    public void testPublishesToBusAndWebhooks() {
        DomainEvent event = DomainEvent.builder()
                .entityType(EntityType.PRODUCT)
                .action(EventAction.DELETED)
                .entityId("5")
                .data(Map.of("id", "5", "name", "Widget"))
                .build();

        publisher.publish(event);

        verify(eventBus).publish("PRODUCT_DELETED", event);
        verify(emitter).emit("product.deleted", Map.of("id", "5"));
    }

    @Test
    public void testUnsupportedActionRejected() {
        DomainEvent event = DomainEvent.builder()
                .entityType(EntityType.TASK)
                .action(EventAction.PUBLISHED)
                .entityId("1")
                .build();

        assertThrows(IllegalArgumentException.class, () -> publisher.publish(event));
        verifyNoInteractions(eventBus, emitter);
    }

    @Test
    public void testWebhookFailureDoesNotPropagate() {
        when(emitter.emit(anyString(), any())).thenThrow(new IllegalStateException("db down"));
        DomainEvent event = DomainEvent.builder()
                .entityType(EntityType.POST)
                .action(EventAction.PUBLISHED)
                .entityId("1")
                .data(Map.of("id", "1", "title", "Hello"))
                .build();

        assertDoesNotThrow(() -> publisher.publish(event));
        verify(eventBus).publish("POST_PUBLISHED", event);
    }
}
