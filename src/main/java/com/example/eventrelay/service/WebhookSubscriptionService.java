package com.example.eventrelay.service;

import com.example.eventrelay.exception.OwnershipViolationException;
import com.example.eventrelay.exception.ResourceNotFoundException;
import com.example.eventrelay.model.DeliveryStatus;
import com.example.eventrelay.model.WebhookEvent;
import com.example.eventrelay.model.WebhookSubscription;
import com.example.eventrelay.model.WebhookSubscriptionRequest;
import com.example.eventrelay.model.WebhookTestResult;
import com.example.eventrelay.repository.WebhookEventRepository;
import com.example.eventrelay.repository.WebhookSubscriptionRepository;
import com.example.eventrelay.service.webhook.WebhookDispatcher;
import com.example.eventrelay.service.webhook.WebhookSender;
import com.example.eventrelay.service.webhook.WebhookSigner;
import com.example.eventrelay.utils.WebhookUrlValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.criteria.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Webhook 订阅管理（按归属者隔离）以及投递记录的查询与人工重试。
 */
@Service
@Slf4j
public class WebhookSubscriptionService {

    private static final Pattern EVENT_NAME = Pattern.compile("[a-z][a-z0-9_]*\\.[a-z][a-z0-9_]*");
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int MAX_PAGE_SIZE = 100;
    static final String TEST_EVENT = "webhook.test";

    private final WebhookSubscriptionRepository subscriptionRepository;
    private final WebhookEventRepository eventRepository;
    private final WebhookUrlValidator urlValidator;
    private final WebhookDispatcher dispatcher;
    private final WebhookSender sender;
    private final WebhookSigner signer;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int defaultMaxRetries;
    private final Duration requestTimeout;

    public WebhookSubscriptionService(WebhookSubscriptionRepository subscriptionRepository,
            WebhookEventRepository eventRepository,
            WebhookUrlValidator urlValidator,
            WebhookDispatcher dispatcher,
            WebhookSender sender,
            WebhookSigner signer,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${app.webhook.default-max-retries:3}") int defaultMaxRetries,
            @Value("${app.webhook.request-timeout-ms:30000}") long requestTimeoutMs) {
        this.subscriptionRepository = subscriptionRepository;
        this.eventRepository = eventRepository;
        this.urlValidator = urlValidator;
        this.dispatcher = dispatcher;
        this.sender = sender;
        this.signer = signer;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.defaultMaxRetries = defaultMaxRetries;
        this.requestTimeout = Duration.ofMillis(requestTimeoutMs);
    }

    public List<WebhookSubscription> list(String owner, Boolean active) {
        if (active == null) {
            return subscriptionRepository.findByOwnerOrderByCreatedAtDesc(owner);
        }
        return subscriptionRepository.findByOwnerAndActiveOrderByCreatedAtDesc(owner, active);
    }

    @Transactional
    public WebhookSubscription create(String owner, WebhookSubscriptionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        urlValidator.validate(request.url());

        WebhookSubscription subscription = WebhookSubscription.builder()
                .url(request.url().trim())
                .events(normalizeEvents(request.events()))
                .secret(generateSecret())
                .active(request.active() == null || request.active())
                .maxRetries(request.maxRetries() == null ? defaultMaxRetries : validateMaxRetries(request.maxRetries()))
                .owner(owner)
                .build();
        if (request.retryBackoff() != null) {
            subscription.setRetryBackoff(request.retryBackoff());
        }

        WebhookSubscription saved = subscriptionRepository.save(subscription);
        log.info("[WebhookAdmin] Subscription {} created by {} for {}", saved.getId(), owner, saved.getEvents());
        return saved;
    }

    public WebhookSubscription get(String owner, Long id) {
        WebhookSubscription subscription = subscriptionRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Webhook subscription " + id + " not found"));
        if (subscription.getOwner() != null && !subscription.getOwner().equals(owner)) {
            throw new OwnershipViolationException("Webhook subscription " + id + " belongs to another user");
        }
        return subscription;
    }

    @Transactional
    public WebhookSubscription update(String owner, Long id, WebhookSubscriptionRequest request) {
        WebhookSubscription subscription = get(owner, id);
        if (request == null) {
            return subscription;
        }
        if (request.url() != null) {
            urlValidator.validate(request.url());
            subscription.setUrl(request.url().trim());
        }
        if (request.events() != null) {
            subscription.setEvents(normalizeEvents(request.events()));
        }
        if (request.active() != null) {
            subscription.setActive(request.active());
        }
        if (request.maxRetries() != null) {
            subscription.setMaxRetries(validateMaxRetries(request.maxRetries()));
        }
        if (request.retryBackoff() != null) {
            subscription.setRetryBackoff(request.retryBackoff());
        }
        return subscriptionRepository.save(subscription);
    }

    @Transactional
    public void delete(String owner, Long id) {
        WebhookSubscription subscription = get(owner, id);
        eventRepository.deleteBySubscriptionId(subscription.getId());
        subscriptionRepository.delete(subscription);
        log.info("[WebhookAdmin] Subscription {} deleted by {}", id, owner);
    }

    /**
     * 同步发送一条 webhook.test 事件，不落库、不重试。
     */
    public WebhookTestResult test(String owner, Long id) {
        WebhookSubscription subscription = get(owner, id);
        long start = System.currentTimeMillis();
        try {
            urlValidator.validate(subscription.getUrl());

            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("event", TEST_EVENT);
            envelope.put("timestamp", clock.instant().toString());
            envelope.put("data", Map.of("message", "This is a test webhook from your API"));
            String body = objectMapper.writeValueAsString(envelope);

            Map<String, String> headers = new LinkedHashMap<>();
            headers.put("X-Webhook-Event", TEST_EVENT);
            headers.put("X-Webhook-Signature", signer.sign(body, subscription.getSecret()));
            headers.put("X-Webhook-Timestamp", clock.instant().toString());

            WebhookSender.WebhookResponse response = sender.post(subscription.getUrl(), body, headers,
                    requestTimeout);
            long elapsed = System.currentTimeMillis() - start;
            return new WebhookTestResult(response.isSuccess(),
                    response.isSuccess() ? "Test webhook delivered successfully" : "Test webhook failed",
                    response.statusCode(), elapsed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new WebhookTestResult(false, "Test webhook failed: interrupted", null,
                    System.currentTimeMillis() - start);
        } catch (Exception e) {
            log.warn("[WebhookAdmin] Test delivery for subscription {} failed: {}", id, e.getMessage());
            return new WebhookTestResult(false, "Test webhook failed: " + e.getMessage(), null,
                    System.currentTimeMillis() - start);
        }
    }

    /**
     * 分页查询调用方名下订阅的投递记录。
     */
    public Page<WebhookEvent> listEvents(String owner, Long subscriptionId, DeliveryStatus status, int page,
            int limit) {
        List<Long> ownedIds = subscriptionRepository.findByOwnerOrderByCreatedAtDesc(owner).stream()
                .map(WebhookSubscription::getId)
                .toList();
        if (subscriptionId != null) {
            get(owner, subscriptionId);
        }
        int size = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        PageRequest pageable = PageRequest.of(Math.max(page - 1, 0), size, Sort.by(Sort.Direction.DESC, "createdAt"));
        if (ownedIds.isEmpty()) {
            return Page.empty(pageable);
        }

        Specification<WebhookEvent> spec = (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(root.get("subscriptionId").in(ownedIds));
            if (subscriptionId != null) {
                predicates.add(cb.equal(root.get("subscriptionId"), subscriptionId));
            }
            if (status != null) {
                predicates.add(cb.equal(root.get("status"), status));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
        return eventRepository.findAll(spec, pageable);
    }

    /**
     * 人工重试。
     * PENDING 事件提前到现在到期；FAILED 事件不会被重新打开，而是复制出一条新的 PENDING 事件并立即投递；
     * DELIVERED 事件拒绝重试。
     *
     * @return 将被投递的事件
     */
    public WebhookEvent retryEvent(String owner, Long eventId) {
        WebhookEvent event = eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Webhook event " + eventId + " not found"));
        get(owner, event.getSubscriptionId());

        LocalDateTime now = LocalDateTime.now(clock);
        WebhookEvent target;
        switch (event.getStatus()) {
            case PENDING -> {
                event.makeDue(now);
                target = eventRepository.save(event);
            }
            case FAILED -> target = eventRepository.save(
                    WebhookEvent.pending(event.getSubscriptionId(), event.getEventType(), event.getPayload(), now));
            default -> throw new IllegalArgumentException("Webhook event " + eventId + " was already delivered");
        }
        log.info("[WebhookAdmin] Event {} queued for retry as {}", eventId, target.getId());
        dispatcher.dispatch(target.getId());
        return target;
    }

    private Set<String> normalizeEvents(Set<String> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("At least one event is required");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String event : events) {
            String value = event == null ? "" : event.trim();
            if (!value.equals(WebhookSubscription.WILDCARD) && !EVENT_NAME.matcher(value).matches()) {
                throw new IllegalArgumentException("Invalid event name: " + event);
            }
            normalized.add(value);
        }
        return normalized;
    }

    private int validateMaxRetries(int maxRetries) {
        if (maxRetries < 0 || maxRetries > 10) {
            throw new IllegalArgumentException("maxRetries must be between 0 and 10");
        }
        return maxRetries;
    }

    private static String generateSecret() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        StringBuilder hex = new StringBuilder(64);
        for (byte b : bytes) {
            hex.append(String.format("%02x", b));
        }
        return hex.toString();
    }
}
