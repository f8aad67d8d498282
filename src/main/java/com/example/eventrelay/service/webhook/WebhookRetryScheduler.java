package com.example.eventrelay.service.webhook;

import com.example.eventrelay.repository.WebhookEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 定时任务：扫描已到期的 PENDING 事件并重新投递。
 * 这是唯一的重试驱动，进程重启后从持久化记录继续，不存在进程内的单事件定时器。
 */
@Component
@Slf4j
public class WebhookRetryScheduler {

    private final WebhookEventRepository eventRepository;
    private final WebhookDispatcher dispatcher;
    private final Clock clock;
    private final int batchSize;

    public WebhookRetryScheduler(WebhookEventRepository eventRepository, WebhookDispatcher dispatcher, Clock clock,
            @Value("${app.webhook.retry-batch-size:100}") int batchSize) {
        this.eventRepository = eventRepository;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    /**
     * 启动完成后立即恢复一次。
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        int count = processPendingRetries();
        log.info("[Webhook] Startup recovery dispatched {} pending retries", count);
    }

    @Scheduled(fixedDelayString = "${app.webhook.retry-sweep-interval-ms:15000}",
            initialDelayString = "${app.webhook.retry-sweep-interval-ms:15000}")
    public void sweep() {
        try {
            processPendingRetries();
        } catch (Exception e) {
            log.error("[Webhook] Retry sweep failed", e);
        }
    }

    /**
     * 加载最多 batchSize 条已到期的 PENDING 事件并逐条投递。
     *
     * @return 本轮派发的事件数
     */
    public int processPendingRetries() {
        List<Long> due = eventRepository.findDueIds(LocalDateTime.now(clock), PageRequest.of(0, batchSize));
        if (due.isEmpty()) {
            return 0;
        }
        log.info("[Webhook] Processing {} pending retries", due.size());
        for (Long id : due) {
            dispatcher.dispatch(id);
        }
        return due.size();
    }
}
