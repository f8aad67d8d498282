package com.example.eventrelay.websocket;

import java.io.IOException;

/**
 * 注册表持有的底层连接抽象，屏蔽具体传输。
 */
public interface ConnectionHandle {

    void send(String text) throws IOException;

    boolean isOpen();

    void close();
}
