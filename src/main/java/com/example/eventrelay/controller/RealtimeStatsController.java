package com.example.eventrelay.controller;

import com.example.eventrelay.model.DeliveryStatus;
import com.example.eventrelay.repository.WebhookEventRepository;
import com.example.eventrelay.service.LiveStreamService;
import com.example.eventrelay.websocket.ConnectionRegistry;
import com.example.eventrelay.websocket.RegistryStats;
import com.example.eventrelay.websocket.VisitorsChannelHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 实时连接与 Webhook 投递统计
 */
@RestController
@RequiredArgsConstructor
public class RealtimeStatsController {

    private final ConnectionRegistry registry;
    private final LiveStreamService liveStreamService;
    private final VisitorsChannelHandler visitorsChannelHandler;
    private final WebhookEventRepository webhookEventRepository;

    @GetMapping("/ws/stats")
    public RegistryStats connectionStats() {
        return registry.getStats();
    }

    @GetMapping("/ws/health")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "ok");
        health.put("connections", registry.connectionCount());
        health.put("timestamp", Instant.now().toString());
        return health;
    }

    /**
     * 汇总注册表、SSE 流、访客数与各状态投递记录数
     */
    @GetMapping("/api/realtime/stats")
    public Map<String, Object> overview() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("websocket", registry.getStats());
        stats.put("sseStreams", liveStreamService.openStreamCount());
        stats.put("visitors", visitorsChannelHandler.getVisitorCount());

        Map<String, Long> deliveries = new LinkedHashMap<>();
        for (DeliveryStatus status : DeliveryStatus.values()) {
            deliveries.put(status.name().toLowerCase(), webhookEventRepository.countByStatus(status));
        }
        stats.put("webhookDeliveries", deliveries);
        stats.put("timestamp", Instant.now().toString());
        return stats;
    }
}
