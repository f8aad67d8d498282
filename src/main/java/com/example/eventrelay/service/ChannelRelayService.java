package com.example.eventrelay.service;

import com.example.eventrelay.model.DomainEvent;
import com.example.eventrelay.model.EntityType;
import com.example.eventrelay.service.bus.BusMessage;
import com.example.eventrelay.service.bus.EventBus;
import com.example.eventrelay.service.bus.EventStream;
import com.example.eventrelay.service.bus.EventStreamPump;
import com.example.eventrelay.websocket.ConnectionRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 将总线上的实体事件转发到 WebSocket 频道：
 * 集合频道（tasks）与实体频道（task:42）；评论转发到 comments 与 post:{postId}:comments。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChannelRelayService {

    private final EventBus eventBus;
    private final EventStreamPump pump;
    private final ConnectionRegistry registry;

    private EventStream<BusMessage> stream;

    @PostConstruct
    public void start() {
        List<String> topics = new ArrayList<>();
        for (EntityType type : EntityType.values()) {
            topics.addAll(type.topics());
        }
        stream = eventBus.subscribe(topics);
        pump.drain(stream, this::relay, () -> log.info("[ChannelRelay] Relay stream closed"));
        log.info("[ChannelRelay] Relaying {} topics to WebSocket channels", topics.size());
    }

    void relay(BusMessage message) {
        DomainEvent event = message.payloadAs(DomainEvent.class);
        if (event == null) {
            return;
        }
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", event.eventType());
        frame.put("data", event.payload());
        frame.put("timestamp", event.getOccurredAt().toString());

        EntityType type = event.getEntityType();
        try {
            registry.broadcast(type.channel(), frame);
            if (type == EntityType.COMMENT) {
                if (event.getParentId() != null) {
                    registry.broadcast("post:" + event.getParentId() + ":comments", frame);
                }
            } else if (event.getEntityId() != null) {
                registry.broadcast(type.entityChannel(event.getEntityId()), frame);
            }
        } catch (RuntimeException e) {
            log.error("[ChannelRelay] Failed to relay {}", message.topic(), e);
        }
    }

    @PreDestroy
    public void stop() {
        if (stream != null) {
            stream.close();
        }
    }
}
