package com.example.eventrelay.service.bus;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * 进程内发布/订阅总线。
 * <p>
 * 每个订阅者都会收到其主题上的每条消息（广播而非竞争消费），
 * 只投递订阅之后发布的消息，不做回放。同一主题的发布串行化，
 * 保证所有订阅者看到相同的顺序。
 */
@Component
@Slf4j
public class EventBus {

    private final Map<String, Set<BlockingEventStream>> subscribers = new ConcurrentHashMap<>();
    private final Map<String, Object> topicLocks = new ConcurrentHashMap<>();

    /**
     * 向主题发布一条消息。没有订阅者时直接丢弃。
     *
     * @param topic   主题
     * @param payload 消息体
     */
    public void publish(String topic, Object payload) {
        BusMessage message = new BusMessage(topic, payload);
        Object lock = topicLocks.computeIfAbsent(topic, k -> new Object());
        synchronized (lock) {
            Set<BlockingEventStream> streams = subscribers.get(topic);
            if (streams == null || streams.isEmpty()) {
                log.debug("[EventBus] No subscribers for topic {}", topic);
                return;
            }
            for (BlockingEventStream stream : streams) {
                stream.offer(message);
            }
        }
    }

    /**
     * 订阅一组主题，返回的流在关闭前持续接收这些主题上的新消息。
     *
     * @param topics 主题集合，不能为空
     * @return 订阅流
     */
    public EventStream<BusMessage> subscribe(Collection<String> topics) {
        if (topics == null || topics.isEmpty()) {
            throw new IllegalArgumentException("At least one topic is required");
        }
        BlockingEventStream stream = new BlockingEventStream(topics, this::detach);
        for (String topic : stream.topics()) {
            subscribers.computeIfAbsent(topic, k -> new CopyOnWriteArraySet<>()).add(stream);
        }
        log.debug("[EventBus] Subscribed to {}", topics);
        return stream;
    }

    /**
     * 当前某主题的订阅者数量。
     */
    public int subscriberCount(String topic) {
        Set<BlockingEventStream> streams = subscribers.get(topic);
        return streams == null ? 0 : streams.size();
    }

    private void detach(BlockingEventStream stream) {
        for (String topic : stream.topics()) {
            subscribers.computeIfPresent(topic, (k, set) -> {
                set.remove(stream);
                return set.isEmpty() ? null : set;
            });
        }
    }

    @PreDestroy
    public void shutdown() {
        List<BlockingEventStream> open = new ArrayList<>();
        subscribers.values().forEach(open::addAll);
        open.forEach(BlockingEventStream::close);
        log.info("[EventBus] Closed {} open streams", open.size());
    }
}
