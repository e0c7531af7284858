package com.suipatreon.indexer.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Tier that unlocks a piece of content. Both sides hold surrogate ids.
 */
@Data
@Entity
@Table(name = "content_tiers", uniqueConstraints = {
        @UniqueConstraint(name = "uq_content_tiers_content_tier", columnNames = {"content_id", "tier_id"})
})
public class ContentTier {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "content_id", nullable = false)
    private UUID contentId;

    @Column(name = "tier_id", nullable = false)
    private UUID tierId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
