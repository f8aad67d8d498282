package com.example.eventrelay.service.bus;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 基于阻塞队列的订阅流。
 * 关闭时投入唤醒哨兵，使阻塞中的 next() 立即返回；注册了到达通知时，每次入队和关闭都会回调。
 */
class BlockingEventStream implements EventStream<BusMessage> {

    private static final BusMessage CLOSED = new BusMessage("", null);

    private final List<String> topics;
    private final BlockingQueue<BusMessage> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Consumer<BlockingEventStream> onClose;
    private volatile Runnable listener;

    BlockingEventStream(Collection<String> topics, Consumer<BlockingEventStream> onClose) {
        this.topics = List.copyOf(topics);
        this.onClose = onClose;
    }

    List<String> topics() {
        return topics;
    }

    /**
     * 由总线在发布线程上调用；已关闭的流静默丢弃。
     */
    void offer(BusMessage message) {
        if (!closed.get()) {
            queue.offer(message);
            signal();
        }
    }

    @Override
    public void onAvailable(Runnable listener) {
        this.listener = listener;
        if (closed.get() || !queue.isEmpty()) {
            signal();
        }
    }

    private void signal() {
        Runnable current = listener;
        if (current != null) {
            current.run();
        }
    }

    @Override
    public BusMessage next() throws InterruptedException {
        if (closed.get()) {
            return null;
        }
        return unwrap(queue.take());
    }

    @Override
    public BusMessage poll(Duration timeout) throws InterruptedException {
        if (closed.get()) {
            return null;
        }
        return unwrap(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    private BusMessage unwrap(BusMessage message) {
        if (message == CLOSED || closed.get()) {
            return null;
        }
        return message;
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            queue.clear();
            queue.offer(CLOSED);
            onClose.accept(this);
            signal();
        }
    }
}
