package com.suipatreon.indexer.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Entity
@Table(name = "contents", uniqueConstraints = {
        @UniqueConstraint(name = "uq_contents_content_id", columnNames = "content_id")
}, indexes = {
        @Index(name = "idx_contents_creator_id", columnList = "creator_id")
})
public class Content {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "content_id", nullable = false)
    private String contentId; // Content object id

    @Column(name = "creator_id", nullable = false)
    private UUID creatorId;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description = "";

    @Column(name = "content_type", nullable = false)
    private String contentType;

    @Column(name = "preview_patch_id")
    private String previewPatchId;

    @Column(name = "sealed_patch_id", nullable = false)
    private String sealedPatchId;

    @Column(name = "is_public", nullable = false)
    private Boolean isPublic = false;

    @Column(name = "published_at")
    private Instant publishedAt;

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
