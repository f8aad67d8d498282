package com.example.eventrelay.service.webhook;

import com.example.eventrelay.model.WebhookEvent;
import com.example.eventrelay.model.WebhookSubscription;
import com.example.eventrelay.repository.WebhookEventRepository;
import com.example.eventrelay.repository.WebhookSubscriptionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 为匹配的订阅创建 PENDING 投递记录，并立即异步投递。
 * 任何异常都不会抛给调用方。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WebhookEventEmitter {

    private final WebhookSubscriptionRepository subscriptionRepository;
    private final WebhookEventRepository eventRepository;
    private final WebhookDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @param eventType 事件名，例如 task.created
     * @param data      事件数据
     * @return 新建的投递记录 ID
     */
    public List<Long> emit(String eventType, Object data) {
        List<Long> created = new ArrayList<>();
        String payload;
        try {
            payload = envelope(eventType, data);
        } catch (JsonProcessingException e) {
            log.error("[Webhook] Cannot serialize payload for {}", eventType, e);
            return created;
        }

        List<WebhookSubscription> subscriptions;
        try {
            subscriptions = subscriptionRepository.findByActiveTrue();
        } catch (RuntimeException e) {
            log.error("[Webhook] Failed to load subscriptions for {}", eventType, e);
            return created;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        for (WebhookSubscription subscription : subscriptions) {
            try {
                if (!subscription.matches(eventType)) {
                    continue;
                }
                WebhookEvent event = eventRepository.save(
                        WebhookEvent.pending(subscription.getId(), eventType, payload, now));
                created.add(event.getId());
                dispatcher.dispatch(event.getId());
            } catch (RuntimeException e) {
                log.error("[Webhook] Error processing subscription {} for {}", subscription.getId(), eventType, e);
            }
        }
        if (!created.isEmpty()) {
            log.debug("[Webhook] Emitted {} to {} subscriptions", eventType, created.size());
        }
        return created;
    }

    private String envelope(String eventType, Object data) throws JsonProcessingException {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("event", eventType);
        envelope.put("timestamp", clock.instant().toString());
        envelope.put("data", data);
        return objectMapper.writeValueAsString(envelope);
    }
}
