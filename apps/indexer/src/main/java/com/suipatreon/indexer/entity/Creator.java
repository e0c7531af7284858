package com.suipatreon.indexer.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Entity
@Table(name = "creators", uniqueConstraints = {
        @UniqueConstraint(name = "uq_creators_address", columnNames = "address"),
        @UniqueConstraint(name = "uq_creators_profile_id", columnNames = "profile_id")
})
public class Creator {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String address; // Sui wallet address

    @Column(name = "profile_id", nullable = false)
    private String profileId; // Profile object id

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String bio = "";

    @Column(name = "avatar_url")
    private String avatarUrl;

    @Column(name = "background_url")
    private String backgroundUrl;

    @Column(nullable = false)
    private Integer topic = 0;

    // Sequence of the last applied ProfileUpdated
    @Column(name = "profile_event_seq", precision = 78, scale = 0)
    private BigInteger profileEventSeq;

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
