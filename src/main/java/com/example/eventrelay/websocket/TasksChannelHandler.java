package com.example.eventrelay.websocket;

import com.example.eventrelay.model.EntityType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * /ws/tasks 频道。
 */
@Component
public class TasksChannelHandler extends EntityChannelHandler {

    public TasksChannelHandler(ConnectionRegistry registry, @Qualifier("taskScheduler") TaskScheduler scheduler,
            ObjectMapper objectMapper,
            @Value("${app.realtime.heartbeat-interval-ms:30000}") long heartbeatIntervalMs,
            @Value("${app.realtime.max-message-length:16384}") int maxMessageLength) {
        super(EntityType.TASK, registry, scheduler, objectMapper, Duration.ofMillis(heartbeatIntervalMs),
                maxMessageLength);
    }
}
