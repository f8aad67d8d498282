package com.example.eventrelay.controller;

import com.example.eventrelay.model.DeliveryStatus;
import com.example.eventrelay.model.WebhookEvent;
import com.example.eventrelay.model.WebhookSubscription;
import com.example.eventrelay.model.WebhookSubscriptionRequest;
import com.example.eventrelay.model.WebhookTestResult;
import com.example.eventrelay.security.Identity;
import com.example.eventrelay.service.WebhookSubscriptionService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Webhook 订阅管理 API，所有操作限定在调用方自己的订阅内。
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookSubscriptionController {

    private final WebhookSubscriptionService subscriptionService;

    @GetMapping
    public List<WebhookSubscription> list(@AuthenticationPrincipal Identity identity,
            @RequestParam(required = false) Boolean active) {
        return subscriptionService.list(identity.userId(), active);
    }

    @PostMapping
    public ResponseEntity<WebhookSubscription> create(@AuthenticationPrincipal Identity identity,
            @RequestBody WebhookSubscriptionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(subscriptionService.create(identity.userId(), request));
    }

    @GetMapping("/{id}")
    public WebhookSubscription get(@AuthenticationPrincipal Identity identity, @PathVariable Long id) {
        return subscriptionService.get(identity.userId(), id);
    }

    @PatchMapping("/{id}")
    public WebhookSubscription update(@AuthenticationPrincipal Identity identity, @PathVariable Long id,
            @RequestBody WebhookSubscriptionRequest request) {
        return subscriptionService.update(identity.userId(), id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@AuthenticationPrincipal Identity identity, @PathVariable Long id) {
        subscriptionService.delete(identity.userId(), id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/test")
    public WebhookTestResult test(@AuthenticationPrincipal Identity identity, @PathVariable Long id) {
        return subscriptionService.test(identity.userId(), id);
    }

    @GetMapping("/events")
    public Map<String, Object> listEvents(@AuthenticationPrincipal Identity identity,
            @RequestParam(required = false) Long subscriptionId,
            @RequestParam(required = false) DeliveryStatus status,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {
        Page<WebhookEvent> events = subscriptionService.listEvents(identity.userId(), subscriptionId, status, page,
                limit);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("total", events.getTotalElements());
        meta.put("page", events.getNumber() + 1);
        meta.put("limit", events.getSize());
        meta.put("totalPages", events.getTotalPages());
        meta.put("hasNextPage", events.hasNext());
        meta.put("hasPreviousPage", events.hasPrevious());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("data", events.getContent());
        body.put("meta", meta);
        return body;
    }

    @PostMapping("/events/{id}/retry")
    public Map<String, Object> retryEvent(@AuthenticationPrincipal Identity identity, @PathVariable Long id) {
        WebhookEvent queued = subscriptionService.retryEvent(identity.userId(), id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Webhook event queued for retry");
        body.put("eventId", queued.getId());
        return body;
    }
}
