package com.example.eventrelay.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次实体变更产生的领域事件。
 * 由 CRUD 处理器构造，经事件总线分发给所有实时消费者与 Webhook 投递。
 */
@Value
@Builder
public class DomainEvent {

    EntityType entityType;
    EventAction action;
    String entityId;

    // 评论所属帖子 ID，其他实体为空
    String parentId;

    String ownerId;

    @Builder.Default
    Map<String, Object> data = Collections.emptyMap();

    @Builder.Default
    Instant occurredAt = Instant.now();

    public String topic() {
        return entityType.topic(action);
    }

    public String eventType() {
        return entityType.eventType(action);
    }

    /**
     * 对外发布的数据：删除事件只携带 id（评论额外携带 postId），其他动作为完整实体数据。
     */
    public Map<String, Object> payload() {
        if (action != EventAction.DELETED) {
            return data;
        }
        Map<String, Object> deleted = new LinkedHashMap<>();
        deleted.put("id", entityId);
        if (entityType == EntityType.COMMENT) {
            deleted.put("postId", parentId);
        }
        return deleted;
    }
}
