package com.example.eventrelay.controller;

import com.example.eventrelay.model.EntityType;
import com.example.eventrelay.security.Identity;
import com.example.eventrelay.security.IdentityResolver;
import com.example.eventrelay.service.LiveStreamService;
import com.example.eventrelay.service.StreamFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * SSE 事件流端点，身份可选：携带有效令牌时只推送本人拥有的实体。
 */
@RestController
@RequestMapping(value = "/sse", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
@RequiredArgsConstructor
public class EventStreamController {

    private final LiveStreamService liveStreamService;
    private final IdentityResolver identityResolver;

    @GetMapping("/tasks")
    public SseEmitter tasks(@RequestParam(required = false) String taskId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return liveStreamService.open(EntityType.TASK, new StreamFilter(taskId, null, userId(authorization)));
    }

    @GetMapping("/products")
    public SseEmitter products(@RequestParam(required = false) String productId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return liveStreamService.open(EntityType.PRODUCT, new StreamFilter(productId, null, userId(authorization)));
    }

    @GetMapping("/posts")
    public SseEmitter posts(@RequestParam(required = false) String postId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return liveStreamService.open(EntityType.POST, new StreamFilter(postId, null, userId(authorization)));
    }

    @GetMapping("/comments")
    public SseEmitter comments(@RequestParam(required = false) String postId,
            @RequestParam(required = false) String commentId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return liveStreamService.open(EntityType.COMMENT, new StreamFilter(commentId, postId, userId(authorization)));
    }

    private String userId(String authorization) {
        if (authorization == null || !authorization.startsWith("Bearer ")) {
            return null;
        }
        return identityResolver.resolve(authorization).map(Identity::userId).orElse(null);
    }
}
