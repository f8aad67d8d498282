package com.example.eventrelay.websocket;

import java.util.List;

/**
 * 注册表快照。
 */
public record RegistryStats(int totalConnections, int totalUsers, List<ChannelStat> channels) {

    public record ChannelStat(String name, int connections) {
    }
}
