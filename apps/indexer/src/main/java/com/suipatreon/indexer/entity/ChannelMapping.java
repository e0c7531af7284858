package com.suipatreon.indexer.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Entity
@Table(name = "channel_mappings", uniqueConstraints = {
        @UniqueConstraint(name = "uq_channel_mappings_channel_id", columnNames = "channel_id"),
        @UniqueConstraint(name = "uq_channel_mappings_user_creator", columnNames = {"user_address", "creator_address"})
})
public class ChannelMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "channel_id", nullable = false)
    private String channelId;

    @Column(name = "user_address", nullable = false)
    private String userAddress;

    @Column(name = "creator_address", nullable = false)
    private String creatorAddress;

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
