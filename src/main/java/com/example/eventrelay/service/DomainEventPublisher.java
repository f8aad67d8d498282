package com.example.eventrelay.service;

import com.example.eventrelay.model.DomainEvent;
import com.example.eventrelay.service.bus.EventBus;
import com.example.eventrelay.service.webhook.WebhookEventEmitter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 实体变更事件的唯一入口。
 * 发布到事件总线主题（如 TASK_CREATED），并以 task.created 形式的事件名触发 Webhook 投递。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DomainEventPublisher {

    private final EventBus eventBus;
    private final WebhookEventEmitter webhookEventEmitter;

    public void publish(DomainEvent event) {
        if (!event.getEntityType().actions().contains(event.getAction())) {
            throw new IllegalArgumentException(
                    event.getEntityType().singular() + " does not support action " + event.getAction());
        }
        log.debug("[EventPublisher] {} {}", event.topic(), event.getEntityId());

        eventBus.publish(event.topic(), event);

        try {
            webhookEventEmitter.emit(event.eventType(), event.payload());
        } catch (RuntimeException e) {
            log.error("[EventPublisher] Webhook emit failed for {}", event.eventType(), e);
        }
    }
}
