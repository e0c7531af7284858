package com.suipatreon.indexer.repository;

import com.suipatreon.indexer.entity.Subscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

    Optional<Subscription> findBySubscriptionId(String subscriptionId);

    List<Subscription> findBySubscriber(String subscriber);
}
