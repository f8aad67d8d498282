package com.example.eventrelay.repository;

import com.example.eventrelay.model.WebhookSubscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WebhookSubscriptionRepository extends JpaRepository<WebhookSubscription, Long> {

    List<WebhookSubscription> findByActiveTrue();

    List<WebhookSubscription> findByOwnerOrderByCreatedAtDesc(String owner);

    List<WebhookSubscription> findByOwnerAndActiveOrderByCreatedAtDesc(String owner, boolean active);

    Optional<WebhookSubscription> findByIdAndOwner(Long id, String owner);
}
