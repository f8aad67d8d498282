package com.example.eventrelay.service;

import com.example.eventrelay.model.DomainEvent;
import com.example.eventrelay.model.EntityType;
import com.example.eventrelay.model.EventAction;
import com.example.eventrelay.service.bus.BusMessage;
import com.example.eventrelay.service.bus.EventBus;
import com.example.eventrelay.service.bus.EventStream;
import com.example.eventrelay.service.bus.EventStreamPump;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单向事件流（SSE）
 * 每个请求订阅对应实体类型的所有主题，按 {@link StreamFilter} 过滤后推送，
 * 并定期发送 heartbeat。客户端断开、超时或发送失败时关闭订阅并停止心跳。
 */
@Service
@Slf4j
public class LiveStreamService {

    private final EventBus eventBus;
    private final EventStreamPump pump;
    private final TaskScheduler scheduler;
    private final Duration heartbeatInterval;
    private final long emitterTimeoutMs;

    private final Set<String> openStreams = ConcurrentHashMap.newKeySet();

    public LiveStreamService(EventBus eventBus, EventStreamPump pump,
            @Qualifier("taskScheduler") TaskScheduler scheduler,
            @Value("${app.realtime.heartbeat-interval-ms:30000}") long heartbeatIntervalMs,
            @Value("${app.realtime.sse-timeout-ms:0}") long emitterTimeoutMs) {
        this.eventBus = eventBus;
        this.pump = pump;
        this.scheduler = scheduler;
        this.heartbeatInterval = Duration.ofMillis(heartbeatIntervalMs);
        this.emitterTimeoutMs = emitterTimeoutMs;
    }

    /**
     * 打开一条事件流。
     *
     * @param type   实体类型
     * @param filter 过滤条件
     * @return 已发送 connected 事件的 emitter
     */
    public SseEmitter open(EntityType type, StreamFilter filter) {
        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        LiveStream stream = new LiveStream(UUID.randomUUID().toString(), type, filter, emitter);
        stream.start();
        return emitter;
    }

    public int openStreamCount() {
        return openStreams.size();
    }

    private final class LiveStream {

        private final String connectionId;
        private final EntityType type;
        private final StreamFilter filter;
        private final SseEmitter emitter;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private EventStream<BusMessage> subscription;
        private volatile ScheduledFuture<?> heartbeat;

        LiveStream(String connectionId, EntityType type, StreamFilter filter, SseEmitter emitter) {
            this.connectionId = connectionId;
            this.type = type;
            this.filter = filter;
            this.emitter = emitter;
        }

        void start() {
            emitter.onCompletion(this::close);
            emitter.onTimeout(this::close);
            emitter.onError(e -> close());

            subscription = eventBus.subscribe(type.topics());
            openStreams.add(connectionId);

            Map<String, Object> connected = new LinkedHashMap<>();
            connected.put("connectionId", connectionId);
            connected.put("channel", type.channel());
            if (type == EntityType.COMMENT) {
                connected.put("postId", filter.parentId());
                connected.put("commentId", filter.entityId());
            } else {
                connected.put(type.idParameter(), filter.entityId());
            }
            connected.put("userId", filter.userId());
            connected.put("timestamp", Instant.now().toString());
            if (!send("connected", connected)) {
                close();
                return;
            }
            log.info("[Sse] Stream {} opened on {}{}", connectionId, type.channel(),
                    filter.userId() != null ? " (user: " + filter.userId() + ")" : "");

            heartbeat = scheduler.scheduleAtFixedRate(() -> {
                if (!send("heartbeat", Map.of("timestamp", Instant.now().toString()))) {
                    close();
                }
            }, Instant.now().plus(heartbeatInterval), heartbeatInterval);
            if (closed.get()) {
                heartbeat.cancel(false);
            }

            pump.drain(subscription, this::onMessage, this::close);
        }

        private void onMessage(BusMessage message) {
            DomainEvent event = message.payloadAs(DomainEvent.class);
            if (event == null || !filter.accepts(event)) {
                return;
            }
            Map<String, Object> data = new LinkedHashMap<>();
            if (event.getAction() == EventAction.DELETED) {
                data.putAll(event.payload());
            } else {
                data.put(type.singular(), event.getData());
            }
            data.put("timestamp", Instant.now().toString());
            if (!send(event.eventType(), data)) {
                // 抛出后由 pump 关闭订阅
                throw new UncheckedIOException(new IOException("SSE client " + connectionId + " gone"));
            }
        }

        private boolean send(String name, Object data) {
            if (closed.get()) {
                return false;
            }
            try {
                emitter.send(SseEmitter.event().name(name).data(data));
                return true;
            } catch (IOException | IllegalStateException e) {
                log.debug("[Sse] Send to {} failed: {}", connectionId, e.getMessage());
                return false;
            }
        }

        void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            if (heartbeat != null) {
                heartbeat.cancel(false);
            }
            if (subscription != null) {
                subscription.close();
            }
            openStreams.remove(connectionId);
            try {
                emitter.complete();
            } catch (IllegalStateException e) {
                log.debug("[Sse] Emitter {} already completed", connectionId);
            }
            log.info("[Sse] Stream {} closed on {}", connectionId, type.channel());
        }
    }
}
