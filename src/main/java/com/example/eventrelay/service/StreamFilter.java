package com.example.eventrelay.service;

import com.example.eventrelay.model.DomainEvent;
import com.example.eventrelay.model.EntityType;
import com.example.eventrelay.model.EventAction;

import java.util.Objects;

/**
 * 单条事件流的过滤条件。仅决定某个流是否推送该事件，不是访问控制。
 *
 * @param entityId 只推送该实体的事件
 * @param parentId 只推送该父实体（评论所属帖子）下的事件
 * @param userId   调用方身份，存在时只推送其本人拥有的实体
 */
public record StreamFilter(String entityId, String parentId, String userId) {

    public static StreamFilter none() {
        return new StreamFilter(null, null, null);
    }

    public boolean accepts(DomainEvent event) {
        if (entityId != null && !entityId.equals(event.getEntityId())) {
            return false;
        }
        if (parentId != null && !parentId.equals(event.getParentId())) {
            return false;
        }
        if (userId != null) {
            // 评论删除事件不携带作者
            if (event.getEntityType() == EntityType.COMMENT && event.getAction() == EventAction.DELETED) {
                return true;
            }
            return userId.equals(ownerOf(event));
        }
        return true;
    }

    private static String ownerOf(DomainEvent event) {
        if (event.getOwnerId() != null) {
            return event.getOwnerId();
        }
        Object owner = event.getData().get(event.getEntityType().ownerField());
        return owner == null ? null : Objects.toString(owner);
    }
}
