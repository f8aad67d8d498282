package com.example.eventrelay.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DomainEventTest {

    @Test
    void testNamesDerivedFromEntityAndAction() {
        DomainEvent event = DomainEvent.builder()
                .entityType(EntityType.POST)
                .action(EventAction.PUBLISHED)
                .entityId("7")
                .build();

        assertEquals("POST_PUBLISHED", event.topic());
        assertEquals("post.published", event.eventType());
        assertEquals("post:7", EntityType.POST.entityChannel("7"));
        assertEquals("postId", EntityType.POST.idParameter());
    }

    @Test
    void testDeletePayloadCarriesOnlyIdentifiers() {
        DomainEvent taskDeleted = DomainEvent.builder()
                .entityType(EntityType.TASK)
                .action(EventAction.DELETED)
                .entityId("42")
                .data(Map.of("id", "42", "name", "secret"))
                .build();
        assertEquals(Map.of("id", "42"), taskDeleted.payload());

        DomainEvent commentDeleted = DomainEvent.builder()
                .entityType(EntityType.COMMENT)
                .action(EventAction.DELETED)
                .entityId("3")
                .parentId("9")
                .build();
        assertEquals(Map.of("id", "3", "postId", "9"), commentDeleted.payload());
    }

    @Test
    void testNonDeletePayloadIsEntityData() {
        Map<String, Object> data = Map.of("id", "1", "name", "Write docs");
        DomainEvent event = DomainEvent.builder()
                .entityType(EntityType.TASK)
                .action(EventAction.UPDATED)
                .entityId("1")
                .data(data)
                .build();

        assertEquals(data, event.payload());
    }

    @Test
    void testOnlyPostsPublish() {
        assertTrue(EntityType.POST.actions().contains(EventAction.PUBLISHED));
        assertFalse(EntityType.TASK.actions().contains(EventAction.PUBLISHED));
        assertEquals(4, EntityType.POST.topics().size());
        assertEquals(EntityType.PRODUCT, EntityType.fromSingular("Product").orElseThrow());
    }
}
