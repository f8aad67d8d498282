package com.example.eventrelay.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class AsyncConfig {

    /**
     * Webhook 首次投递与重试扫描使用的线程池。
     */
    @Bean(name = "webhookExecutor")
    public ThreadPoolTaskExecutor webhookExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        // Core pool size: threads to keep alive
        executor.setCorePoolSize(10);
        // Max pool size: max threads to allow
        executor.setMaxPoolSize(50);
        // Queue capacity: tasks to buffer
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("Webhook-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(35);
        executor.initialize();
        return executor;
    }

    /**
     * 订阅流排空线程池：所有打开的流共享，只在流有新消息时占用线程。
     */
    @Bean(name = "streamPumpExecutor")
    public ThreadPoolTaskExecutor streamPumpExecutor(
            @Value("${app.realtime.pump-threads:16}") int threads,
            @Value("${app.realtime.pump-queue-capacity:10000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("StreamPump-");
        executor.initialize();
        return executor;
    }

    /**
     * 心跳定时器。
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("Heartbeat-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
