package com.example.eventrelay.model;

/**
 * 实体生命周期动作。
 */
public enum EventAction {
    CREATED,
    UPDATED,
    DELETED,
    PUBLISHED;

    /**
     * 对外事件名中使用的小写形式，例如 "created"。
     *
     * @return 小写动作名
     */
    public String value() {
        return name().toLowerCase();
    }
}
