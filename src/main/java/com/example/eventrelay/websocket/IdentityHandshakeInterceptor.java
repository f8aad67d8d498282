package com.example.eventrelay.websocket;

import com.example.eventrelay.security.Identity;
import com.example.eventrelay.security.IdentityResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import jakarta.servlet.http.Cookie;
import java.util.Map;
import java.util.Optional;

/**
 * 握手阶段的可选身份解析
 * 优先读取 Authorization 请求头，缺失时回退到名为 token 的 Cookie；解析失败按匿名连接处理，从不拒绝握手。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IdentityHandshakeInterceptor implements HandshakeInterceptor {

    static final String USER_ID_ATTR = "userId";
    private static final String TOKEN_COOKIE = "token";

    private final IdentityResolver identityResolver;

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response, WebSocketHandler wsHandler,
            Map<String, Object> attributes) {
        String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        Optional<Identity> identity;
        if (header != null && header.startsWith("Bearer ")) {
            identity = identityResolver.resolve(header);
        } else {
            identity = identityResolver.resolve(cookieToken(request));
        }

        identity.ifPresentOrElse(
                id -> attributes.put(USER_ID_ATTR, id.userId()),
                () -> log.debug("[Handshake] Anonymous connection from {}", request.getRemoteAddress()));
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response, WebSocketHandler wsHandler,
            Exception exception) {
        // no-op
    }

    private String cookieToken(ServerHttpRequest request) {
        if (request instanceof ServletServerHttpRequest servletRequest) {
            Cookie[] cookies = servletRequest.getServletRequest().getCookies();
            if (cookies != null) {
                for (Cookie cookie : cookies) {
                    if (TOKEN_COOKIE.equals(cookie.getName())) {
                        return cookie.getValue();
                    }
                }
            }
        }
        return null;
    }
}
