package com.example.eventrelay.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 一条 Webhook 投递记录。
 * <p>
 * 状态只能单向迁移：PENDING → DELIVERED 或 PENDING → FAILED；attempts 只增不减；
 * nextRetry 仅在 PENDING 时有意义。迁移方法在违反约束时抛出 {@link IllegalStateException}。
 */
@Entity
@Table(name = "webhook_event", indexes = {
        @Index(name = "idx_webhook_event_due", columnList = "status,nextRetry"),
        @Index(name = "idx_webhook_event_subscription", columnList = "subscriptionId")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WebhookEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long subscriptionId;

    @Column(nullable = false, length = 100)
    private String eventType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private DeliveryStatus status = DeliveryStatus.PENDING;

    @Builder.Default
    private int attempts = 0;

    private LocalDateTime lastAttempt;

    private LocalDateTime nextRetry;

    private Integer responseCode;

    @Column(columnDefinition = "TEXT")
    private String responseBody;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    // 由 pending(...) 按注入的 Clock 写入
    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static WebhookEvent pending(Long subscriptionId, String eventType, String payload, LocalDateTime now) {
        return WebhookEvent.builder()
                .subscriptionId(subscriptionId)
                .eventType(eventType)
                .payload(payload)
                .nextRetry(now)
                .createdAt(now)
                .build();
    }

    public boolean isDue(LocalDateTime now) {
        return status == DeliveryStatus.PENDING && (nextRetry == null || !nextRetry.isAfter(now));
    }

    public void markDelivered(int responseCode, String responseBody, LocalDateTime now) {
        requirePending("deliver");
        this.status = DeliveryStatus.DELIVERED;
        this.attempts++;
        this.lastAttempt = now;
        this.nextRetry = null;
        this.responseCode = responseCode;
        this.responseBody = responseBody;
        this.errorMessage = null;
    }

    public void scheduleRetry(Integer responseCode, String responseBody, String errorMessage,
            LocalDateTime now, LocalDateTime nextRetry) {
        requirePending("schedule retry for");
        this.attempts++;
        this.lastAttempt = now;
        this.nextRetry = nextRetry;
        this.responseCode = responseCode;
        this.responseBody = responseBody;
        this.errorMessage = errorMessage;
    }

    public void markFailed(Integer responseCode, String responseBody, String errorMessage, LocalDateTime now) {
        requirePending("fail");
        this.status = DeliveryStatus.FAILED;
        this.attempts++;
        this.lastAttempt = now;
        this.nextRetry = null;
        this.responseCode = responseCode;
        this.responseBody = responseBody;
        this.errorMessage = errorMessage;
    }

    /**
     * 将待投递事件提前到 now 到期（人工重试）。
     */
    public void makeDue(LocalDateTime now) {
        requirePending("re-drive");
        this.nextRetry = now;
    }

    private void requirePending(String action) {
        if (status != DeliveryStatus.PENDING) {
            throw new IllegalStateException("Cannot " + action + " webhook event " + id + " in status " + status);
        }
    }
}
