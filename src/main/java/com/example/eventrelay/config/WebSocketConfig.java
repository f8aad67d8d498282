package com.example.eventrelay.config;

import com.example.eventrelay.graphql.GraphQlTransportHandler;
import com.example.eventrelay.websocket.IdentityHandshakeInterceptor;
import com.example.eventrelay.websocket.PostsChannelHandler;
import com.example.eventrelay.websocket.ProductsChannelHandler;
import com.example.eventrelay.websocket.TasksChannelHandler;
import com.example.eventrelay.websocket.VisitorsChannelHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * WebSocket 配置
 * 实体频道、访客频道与 GraphQL 订阅端点
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final TasksChannelHandler tasksChannelHandler;
    private final ProductsChannelHandler productsChannelHandler;
    private final PostsChannelHandler postsChannelHandler;
    private final VisitorsChannelHandler visitorsChannelHandler;
    private final GraphQlTransportHandler graphQlTransportHandler;
    private final IdentityHandshakeInterceptor identityHandshakeInterceptor;

    @Value("${app.realtime.allowed-origins:*}")
    private String allowedOrigins;

    /**
     * 注册 WebSocket 处理器。
     *
     * @param registry 注册器
     */
    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String[] origins = allowedOrigins.split(",");
        registry.addHandler(tasksChannelHandler, "/ws/tasks")
                .addInterceptors(identityHandshakeInterceptor)
                .setAllowedOriginPatterns(origins);
        registry.addHandler(productsChannelHandler, "/ws/products")
                .addInterceptors(identityHandshakeInterceptor)
                .setAllowedOriginPatterns(origins);
        registry.addHandler(postsChannelHandler, "/ws/posts")
                .addInterceptors(identityHandshakeInterceptor)
                .setAllowedOriginPatterns(origins);
        registry.addHandler(visitorsChannelHandler, "/ws/visitors")
                .setAllowedOriginPatterns(origins);
        registry.addHandler(graphQlTransportHandler, "/graphql")
                .setAllowedOriginPatterns(origins);
    }
}
