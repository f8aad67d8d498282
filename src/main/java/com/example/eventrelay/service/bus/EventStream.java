package com.example.eventrelay.service.bus;

import java.time.Duration;

/**
 * 可显式关闭的拉取式事件序列。
 * 关闭后不再产生任何元素，重复关闭无副作用。
 *
 * @param <T> 元素类型
 */
public interface EventStream<T> extends AutoCloseable {

    /**
     * 阻塞直到下一个元素到达。
     *
     * @return 下一个元素；序列已关闭时返回 null
     * @throws InterruptedException 等待期间线程被中断
     */
    T next() throws InterruptedException;

    /**
     * 最多等待 timeout 获取下一个元素。
     *
     * @return 下一个元素；超时或已关闭时返回 null
     * @throws InterruptedException 等待期间线程被中断
     */
    T poll(Duration timeout) throws InterruptedException;

    /**
     * 注册到达通知：有新元素入队或序列被关闭时回调。
     * 回调运行在发布方线程上，不能阻塞；注册时若已有积压元素或已关闭，立即回调一次。
     *
     * @param listener 通知回调，只保留最后一次注册的
     */
    void onAvailable(Runnable listener);

    boolean isClosed();

    @Override
    void close();
}
