package com.example.eventrelay.service.webhook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * 在 webhookExecutor 上异步执行投递，调用方不等待结果。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WebhookDispatcher {

    private final WebhookDeliveryService deliveryService;

    @Async("webhookExecutor")
    public void dispatch(Long eventId) {
        try {
            deliveryService.deliver(eventId);
        } catch (Exception e) {
            // 状态未能落库时事件仍为 PENDING，由重试扫描兜底
            log.error("[Webhook] Delivery of event {} crashed", eventId, e);
        }
    }
}
