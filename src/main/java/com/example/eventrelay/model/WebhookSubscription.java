package com.example.eventrelay.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "webhook_subscription")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookSubscription {

    public static final String WILDCARD = "*";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 2048)
    private String url;

    // 事件名集合，例如 ["task.created", "post.published"]，或通配符 "*"
    @Convert(converter = EventFilterConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    @Builder.Default
    private Set<String> events = new LinkedHashSet<>();

    @Column(nullable = false, length = 128)
    private String secret;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private int maxRetries = 3;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private RetryBackoff retryBackoff = RetryBackoff.EXPONENTIAL;

    // 创建者 userId
    private String owner;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    /**
     * @param eventType 事件名
     * @return 过滤集合包含该事件名或通配符时返回 true
     */
    public boolean matches(String eventType) {
        return events != null && (events.contains(WILDCARD) || events.contains(eventType));
    }
}
