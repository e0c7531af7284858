package com.suipatreon.indexer.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Entity
@Table(name = "subscriptions", uniqueConstraints = {
        @UniqueConstraint(name = "uq_subscriptions_subscription_id", columnNames = "subscription_id")
}, indexes = {
        @Index(name = "idx_subscriptions_subscriber", columnList = "subscriber"),
        @Index(name = "idx_subscriptions_tier_id", columnList = "tier_id")
})
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "subscription_id", nullable = false)
    private String subscriptionId; // Subscription NFT object id

    @Column(nullable = false)
    private String subscriber;

    @Column(name = "tier_id", nullable = false)
    private UUID tierId; // tiers.id, no foreign key

    @Column(name = "amount_paid", nullable = false, precision = 78, scale = 0)
    private BigInteger amountPaid = BigInteger.ZERO;

    @Column(name = "starts_at", nullable = false)
    private Instant startsAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
