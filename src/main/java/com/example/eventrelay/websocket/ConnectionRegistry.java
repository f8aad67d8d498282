package com.example.eventrelay.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 在线连接注册表
 * 维护连接、频道成员关系和用户索引，提供广播与单播。
 * <p>
 * 频道条目当且仅当至少有一个成员时存在，最后一个成员离开时删除。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConnectionRegistry {

    private final ObjectMapper objectMapper;

    // 键：connectionId
    private final Map<String, LiveConnection> connections = new ConcurrentHashMap<>();

    // 键：频道名，值：connectionId 集合
    private final Map<String, Set<String>> channels = new ConcurrentHashMap<>();

    // 键：userId，值：connectionId 集合
    private final Map<String, Set<String>> userConnections = new ConcurrentHashMap<>();

    public void addConnection(String id, ConnectionHandle handle, String userId) {
        LiveConnection connection = new LiveConnection(id, handle, userId);
        LiveConnection previous = connections.put(id, connection);
        if (previous != null) {
            log.warn("[ConnectionRegistry] Connection id {} reused, replacing", id);
            detach(previous);
        }
        if (userId != null) {
            addMember(userConnections, userId, id);
        }
        log.info("[ConnectionRegistry] Connection added: {} (user={}), total={}", id, userId, connections.size());
    }

    /**
     * 移除连接，并让它离开所属的所有频道。
     */
    public void removeConnection(String id) {
        LiveConnection connection = connections.remove(id);
        if (connection == null) {
            return;
        }
        detach(connection);
        log.info("[ConnectionRegistry] Connection removed: {}, total={}", id, connections.size());
    }

    private void detach(LiveConnection connection) {
        for (String channel : connection.getChannels()) {
            removeMember(channel, connection.getId());
        }
        connection.getChannels().clear();
        if (connection.getUserId() != null) {
            userConnections.computeIfPresent(connection.getUserId(), (k, ids) -> {
                ids.remove(connection.getId());
                return ids.isEmpty() ? null : ids;
            });
        }
    }

    /**
     * @return 连接不存在时返回 false
     */
    public boolean joinChannel(String id, String channel) {
        LiveConnection connection = connections.get(id);
        if (connection == null) {
            return false;
        }
        addMember(channels, channel, id);
        connection.getChannels().add(channel);
        log.debug("[ConnectionRegistry] {} joined {}", id, channel);
        return true;
    }

    public boolean leaveChannel(String id, String channel) {
        LiveConnection connection = connections.get(id);
        if (connection == null) {
            return false;
        }
        connection.getChannels().remove(channel);
        removeMember(channel, id);
        log.debug("[ConnectionRegistry] {} left {}", id, channel);
        return true;
    }

    // 加入必须与最后一个成员离开时的删除在同一个 compute 内完成，否则可能加入已被移除的集合
    private static void addMember(Map<String, Set<String>> index, String key, String id) {
        index.compute(key, (k, members) -> {
            Set<String> target = members == null ? ConcurrentHashMap.<String>newKeySet() : members;
            target.add(id);
            return target;
        });
    }

    private void removeMember(String channel, String id) {
        channels.computeIfPresent(channel, (k, members) -> {
            members.remove(id);
            return members.isEmpty() ? null : members;
        });
    }

    /**
     * 向频道内所有连接广播。单个连接发送失败时将其视为死连接移除，继续投递其余连接。
     *
     * @return 成功送达的连接数
     */
    public int broadcast(String channel, Object message) {
        Set<String> members = channels.get(channel);
        if (members == null || members.isEmpty()) {
            return 0;
        }
        String text = serialize(message);
        if (text == null) {
            return 0;
        }
        int delivered = 0;
        for (String id : new ArrayList<>(members)) {
            if (deliver(id, text)) {
                delivered++;
            }
        }
        log.debug("[ConnectionRegistry] Broadcast to {}: {}/{} delivered", channel, delivered, members.size());
        return delivered;
    }

    public boolean sendToConnection(String id, Object message) {
        String text = serialize(message);
        return text != null && deliver(id, text);
    }

    /**
     * @return 成功送达的连接数
     */
    public int sendToUser(String userId, Object message) {
        Set<String> ids = userConnections.get(userId);
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        String text = serialize(message);
        if (text == null) {
            return 0;
        }
        int delivered = 0;
        for (String id : new ArrayList<>(ids)) {
            if (deliver(id, text)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliver(String id, String text) {
        LiveConnection connection = connections.get(id);
        if (connection == null) {
            return false;
        }
        try {
            if (!connection.getHandle().isOpen()) {
                throw new IOException("connection closed");
            }
            connection.getHandle().send(text);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("[ConnectionRegistry] Send to {} failed, removing dead connection: {}", id, e.getMessage());
            removeConnection(id);
            return false;
        }
    }

    private String serialize(Object message) {
        if (message instanceof String s) {
            return s;
        }
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("[ConnectionRegistry] Failed to serialize message", e);
            return null;
        }
    }

    public boolean isConnected(String id) {
        return connections.containsKey(id);
    }

    public int connectionCount() {
        return connections.size();
    }

    public Set<String> channelsOf(String id) {
        LiveConnection connection = connections.get(id);
        return connection == null ? Set.of() : Set.copyOf(connection.getChannels());
    }

    public RegistryStats getStats() {
        List<RegistryStats.ChannelStat> channelStats = new ArrayList<>();
        channels.forEach((name, members) -> channelStats.add(new RegistryStats.ChannelStat(name, members.size())));
        channelStats.sort(Comparator.comparing(RegistryStats.ChannelStat::name));
        return new RegistryStats(connections.size(), userConnections.size(), channelStats);
    }

    @PreDestroy
    public void closeAll() {
        int count = connections.size();
        for (LiveConnection connection : new ArrayList<>(connections.values())) {
            connection.getHandle().close();
            removeConnection(connection.getId());
        }
        log.info("[ConnectionRegistry] Closed {} connections on shutdown", count);
    }
}
