package com.example.eventrelay.websocket;

import lombok.Getter;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 注册表中的一个在线连接。
 */
@Getter
public class LiveConnection {

    private final String id;
    private final ConnectionHandle handle;
    private final String userId;
    private final Set<String> channels = ConcurrentHashMap.newKeySet();
    private final Instant connectedAt = Instant.now();

    LiveConnection(String id, ConnectionHandle handle, String userId) {
        this.id = id;
        this.handle = handle;
        this.userId = userId;
    }
}
