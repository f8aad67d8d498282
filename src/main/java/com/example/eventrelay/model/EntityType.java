package com.example.eventrelay.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 产生事件的实体类型，以及由它派生出的频道名、总线主题和 Webhook 事件名。
 */
public enum EntityType {
    TASK("task", "tasks", "owner", List.of(EventAction.CREATED, EventAction.UPDATED, EventAction.DELETED)),
    PRODUCT("product", "products", "owner", List.of(EventAction.CREATED, EventAction.UPDATED, EventAction.DELETED)),
    POST("post", "posts", "author",
            List.of(EventAction.CREATED, EventAction.UPDATED, EventAction.DELETED, EventAction.PUBLISHED)),
    COMMENT("comment", "comments", "authorId", List.of(EventAction.CREATED, EventAction.UPDATED, EventAction.DELETED));

    private final String singular;
    private final String plural;
    private final String ownerField;
    private final List<EventAction> actions;

    EntityType(String singular, String plural, String ownerField, List<EventAction> actions) {
        this.singular = singular;
        this.plural = plural;
        this.ownerField = ownerField;
        this.actions = actions;
    }

    public String singular() {
        return singular;
    }

    /**
     * 集合频道名，例如 "tasks"。
     */
    public String channel() {
        return plural;
    }

    /**
     * 单个实体的细粒度频道名，例如 "task:42"。
     */
    public String entityChannel(String entityId) {
        return singular + ":" + entityId;
    }

    /**
     * 事件数据中表示归属者的字段名（帖子为 author）。
     */
    public String ownerField() {
        return ownerField;
    }

    /**
     * 客户端订阅过滤参数名，例如 "taskId"。
     */
    public String idParameter() {
        return singular + "Id";
    }

    public List<EventAction> actions() {
        return actions;
    }

    /**
     * 事件总线主题，例如 "TASK_CREATED"。
     */
    public String topic(EventAction action) {
        return name() + "_" + action.name();
    }

    /**
     * 该实体类型所有动作对应的总线主题。
     */
    public List<String> topics() {
        return actions.stream().map(this::topic).toList();
    }

    /**
     * 对外事件名，例如 "task.created"。
     */
    public String eventType(EventAction action) {
        return singular + "." + action.value();
    }

    public static Optional<EntityType> fromSingular(String value) {
        return Arrays.stream(values()).filter(t -> t.singular.equalsIgnoreCase(value)).findFirst();
    }
}
