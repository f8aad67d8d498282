package com.example.eventrelay.service.webhook;

import com.example.eventrelay.model.WebhookEvent;
import com.example.eventrelay.model.WebhookSubscription;
import com.example.eventrelay.repository.WebhookEventRepository;
import com.example.eventrelay.repository.WebhookSubscriptionRepository;
import com.example.eventrelay.utils.WebhookUrlValidator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Webhook 投递服务
 * <p>
 * 对单条 PENDING 事件执行一次投递尝试并持久化结果：
 * 2xx 标记 DELIVERED；其他状态码或网络错误时，若本次尝试前的次数小于 maxRetries
 * 则按退避策略写入 nextRetry，否则标记 FAILED。
 * 每次发送前都重新做 SSRF 校验，目标被拒绝时直接标记 FAILED，不再重试。
 * 重试本身不在此处调度，由 {@link WebhookRetryScheduler} 扫描到期事件统一驱动。
 */
@Service
@Slf4j
public class WebhookDeliveryService {

    static final String HEADER_EVENT = "X-Webhook-Event";
    static final String HEADER_SIGNATURE = "X-Webhook-Signature";
    static final String HEADER_TIMESTAMP = "X-Webhook-Timestamp";
    static final String HEADER_ID = "X-Webhook-ID";

    private final WebhookEventRepository eventRepository;
    private final WebhookSubscriptionRepository subscriptionRepository;
    private final WebhookSender sender;
    private final WebhookSigner signer;
    private final ChatEmbedFormatter chatFormatter;
    private final WebhookUrlValidator urlValidator;
    private final Clock clock;
    private final Duration requestTimeout;
    private final int responseBodyLimit;

    private final Counter deliveredCounter;
    private final Counter retryCounter;
    private final Counter failedCounter;

    // 正在投递的事件 ID，防止立即投递与重试扫描并发处理同一事件
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public WebhookDeliveryService(WebhookEventRepository eventRepository,
            WebhookSubscriptionRepository subscriptionRepository,
            WebhookSender sender,
            WebhookSigner signer,
            ChatEmbedFormatter chatFormatter,
            WebhookUrlValidator urlValidator,
            Clock clock,
            MeterRegistry meterRegistry,
            @Value("${app.webhook.request-timeout-ms:30000}") long requestTimeoutMs,
            @Value("${app.webhook.response-body-limit:1000}") int responseBodyLimit) {
        this.eventRepository = eventRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.sender = sender;
        this.signer = signer;
        this.chatFormatter = chatFormatter;
        this.urlValidator = urlValidator;
        this.clock = clock;
        this.requestTimeout = Duration.ofMillis(requestTimeoutMs);
        this.responseBodyLimit = responseBodyLimit;
        this.deliveredCounter = outcomeCounter(meterRegistry, "delivered");
        this.retryCounter = outcomeCounter(meterRegistry, "retry");
        this.failedCounter = outcomeCounter(meterRegistry, "failed");
    }

    private static Counter outcomeCounter(MeterRegistry registry, String outcome) {
        return Counter.builder("webhook.delivery")
                .description("Webhook delivery attempts by outcome")
                .tag("outcome", outcome)
                .register(registry);
    }

    /**
     * 对事件执行一次投递尝试。
     *
     * @param eventId 事件 ID
     * @return 本次调用的结果
     */
    public DeliveryOutcome deliver(Long eventId) {
        if (!inFlight.add(eventId)) {
            log.debug("[Webhook] Event {} already in flight, skipping", eventId);
            return DeliveryOutcome.SKIPPED;
        }
        try {
            return attempt(eventId);
        } finally {
            inFlight.remove(eventId);
        }
    }

    private DeliveryOutcome attempt(Long eventId) {
        Optional<WebhookEvent> found = eventRepository.findById(eventId);
        if (found.isEmpty()) {
            log.error("[Webhook] Event {} not found", eventId);
            return DeliveryOutcome.ABORTED;
        }
        WebhookEvent event = found.get();

        LocalDateTime now = LocalDateTime.now(clock);
        if (!event.isDue(now)) {
            log.debug("[Webhook] Event {} is {} / not due until {}, skipping", eventId, event.getStatus(),
                    event.getNextRetry());
            return DeliveryOutcome.SKIPPED;
        }

        Optional<WebhookSubscription> subscription = subscriptionRepository.findById(event.getSubscriptionId());
        if (subscription.isEmpty()) {
            log.error("[Webhook] Subscription {} not found for event {}", event.getSubscriptionId(), eventId);
            return DeliveryOutcome.ABORTED;
        }
        WebhookSubscription sub = subscription.get();
        if (!sub.isActive()) {
            log.warn("[Webhook] Subscription {} is inactive, skipping delivery of event {}", sub.getId(), eventId);
            return DeliveryOutcome.ABORTED;
        }

        try {
            urlValidator.validate(sub.getUrl());
        } catch (IllegalArgumentException e) {
            event.markFailed(null, null, "Blocked destination: " + e.getMessage(), now);
            eventRepository.save(event);
            failedCounter.increment();
            log.warn("[SSRF] Refused delivery of event {} to {}: {}", eventId, sub.getUrl(), e.getMessage());
            return DeliveryOutcome.FAILED;
        }

        boolean chat = chatFormatter.supports(sub.getUrl());
        String body = chat ? chatFormatter.format(event.getPayload()) : event.getPayload();
        Map<String, String> headers = new LinkedHashMap<>();
        if (!chat) {
            headers.put(HEADER_EVENT, event.getEventType());
            headers.put(HEADER_SIGNATURE, signer.sign(body, sub.getSecret()));
            headers.put(HEADER_TIMESTAMP, clock.instant().toString());
            headers.put(HEADER_ID, String.valueOf(event.getId()));
        }

        long start = System.currentTimeMillis();
        try {
            WebhookSender.WebhookResponse response = sender.post(sub.getUrl(), body, headers, requestTimeout);
            long elapsed = System.currentTimeMillis() - start;
            String responseBody = truncate(response.body());

            if (response.isSuccess()) {
                event.markDelivered(response.statusCode(), responseBody, LocalDateTime.now(clock));
                eventRepository.save(event);
                deliveredCounter.increment();
                log.info("[Webhook] Delivered event {} to {} {} ({}ms, {})", eventId,
                        chat ? "chat webhook" : "webhook", sub.getUrl(), elapsed, response.statusCode());
                return DeliveryOutcome.DELIVERED;
            }
            return handleFailure(event, sub, response.statusCode(), responseBody, "HTTP " + response.statusCode());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return handleFailure(event, sub, null, null, "Network error: interrupted");
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return handleFailure(event, sub, null, null, "Network error: " + message);
        }
    }

    private DeliveryOutcome handleFailure(WebhookEvent event, WebhookSubscription sub, Integer statusCode,
            String responseBody, String error) {
        LocalDateTime now = LocalDateTime.now(clock);
        // 以本次尝试前的次数判断：attempts = maxRetries - 1 时仍会进入重试
        if (event.getAttempts() < sub.getMaxRetries()) {
            int attempts = event.getAttempts() + 1;
            LocalDateTime nextRetry = now.plus(sub.getRetryBackoff().delayAfter(attempts));
            event.scheduleRetry(statusCode, responseBody, error, now, nextRetry);
            eventRepository.save(event);
            retryCounter.increment();
            log.warn("[Webhook] Failed to deliver event {} ({}), will retry at {} (attempt {}/{})",
                    event.getId(), error, nextRetry, attempts, sub.getMaxRetries());
            return DeliveryOutcome.RETRY_SCHEDULED;
        }

        event.markFailed(statusCode, responseBody,
                "Max retries (" + sub.getMaxRetries() + ") exceeded. Last error: " + error, now);
        eventRepository.save(event);
        failedCounter.increment();
        log.error("[Webhook] Failed to deliver event {} after {} attempts: {}", event.getId(), event.getAttempts(),
                error);
        return DeliveryOutcome.FAILED;
    }

    private String truncate(String body) {
        if (body == null) {
            return null;
        }
        return body.length() > responseBodyLimit ? body.substring(0, responseBodyLimit) : body;
    }

    boolean isInFlight(Long eventId) {
        return inFlight.contains(eventId);
    }
}
