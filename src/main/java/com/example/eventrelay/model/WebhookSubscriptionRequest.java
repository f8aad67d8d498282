package com.example.eventrelay.model;

import java.util.Set;

/**
 * 创建或部分更新订阅的请求体；更新时 null 字段表示不修改。
 */
public record WebhookSubscriptionRequest(
        String url,
        Set<String> events,
        Boolean active,
        Integer maxRetries,
        RetryBackoff retryBackoff) {
}
