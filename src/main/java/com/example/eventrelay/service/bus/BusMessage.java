package com.example.eventrelay.service.bus;

/**
 * 总线上传递的一条消息。
 *
 * @param topic   发布时的主题
 * @param payload 消息体
 */
public record BusMessage(String topic, Object payload) {

    @SuppressWarnings("unchecked")
    public <T> T payloadAs(Class<T> type) {
        return type.isInstance(payload) ? (T) payload : null;
    }
}
