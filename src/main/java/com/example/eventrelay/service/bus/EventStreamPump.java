package com.example.eventrelay.service.bus;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 将订阅流交给回调处理。
 * <p>
 * 流有新元素时才向共享线程池提交一次排空任务，空闲的流不占用线程；
 * 同一个流的回调串行执行，保持发布顺序。回调抛出异常时关闭流，流关闭后调用一次 onEnd。
 */
@Component
@Slf4j
public class EventStreamPump {

    private final TaskExecutor executor;

    public EventStreamPump(@Qualifier("streamPumpExecutor") TaskExecutor executor) {
        this.executor = executor;
    }

    /**
     * 开始消费流，立即返回。
     *
     * @param stream  订阅流
     * @param handler 每条消息的处理回调
     * @param onEnd   流结束后的回调，可为 null
     */
    public <T> void drain(EventStream<T> stream, Consumer<T> handler, Runnable onEnd) {
        Drain<T> drain = new Drain<>(stream, handler, onEnd);
        stream.onAvailable(drain::signal);
    }

    private final class Drain<T> implements Runnable {

        private final EventStream<T> stream;
        private final Consumer<T> handler;
        private final Runnable onEnd;

        // 未处理的通知数；从 0 变为 1 的一方负责提交排空任务
        private final AtomicInteger pending = new AtomicInteger();
        private final AtomicBoolean ended = new AtomicBoolean(false);

        Drain(EventStream<T> stream, Consumer<T> handler, Runnable onEnd) {
            this.stream = stream;
            this.handler = handler;
            this.onEnd = onEnd;
        }

        void signal() {
            if (pending.getAndIncrement() != 0) {
                return;
            }
            try {
                executor.execute(this);
            } catch (TaskRejectedException e) {
                log.warn("[StreamPump] Executor saturated, closing stream");
                stream.close();
                finish();
            }
        }

        @Override
        public void run() {
            int missed = 1;
            try {
                do {
                    T item;
                    while ((item = stream.poll(Duration.ZERO)) != null) {
                        try {
                            handler.accept(item);
                        } catch (RuntimeException e) {
                            log.warn("[StreamPump] Handler failed, closing stream: {}", e.getMessage());
                            stream.close();
                        }
                    }
                    if (stream.isClosed()) {
                        finish();
                        return;
                    }
                    missed = pending.addAndGet(-missed);
                } while (missed != 0);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stream.close();
                finish();
            }
        }

        private void finish() {
            if (ended.compareAndSet(false, true) && onEnd != null) {
                onEnd.run();
            }
        }
    }
}
