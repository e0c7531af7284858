package com.suipatreon.indexer.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Entity
@Table(name = "tiers", uniqueConstraints = {
        @UniqueConstraint(name = "uq_tiers_tier_id", columnNames = "tier_id")
}, indexes = {
        @Index(name = "idx_tiers_creator_id", columnList = "creator_id")
})
public class Tier {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tier_id", nullable = false)
    private String tierId; // Tier object id

    @Column(name = "creator_id", nullable = false)
    private UUID creatorId; // creators.id, no foreign key

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description = "";

    // Base units of the payment token
    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger price = BigInteger.ZERO;

    // Sequence of the TierPriceUpdated that set the price, null while it is the creation price
    @Column(name = "price_event_seq", precision = 78, scale = 0)
    private BigInteger priceEventSeq;

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
