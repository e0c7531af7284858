package com.suipatreon.indexer.entity;

import com.suipatreon.indexer.sync.EventType;
import jakarta.persistence.*;
import lombok.Data;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Event whose handler failed after its retries. Kept for operator visibility and replay.
 */
@Data
@Entity
@Table(name = "sync_errors", uniqueConstraints = {
        @UniqueConstraint(name = "uq_sync_errors_event", columnNames = {"event_type", "tx_digest", "event_seq"})
}, indexes = {
        @Index(name = "idx_sync_errors_resolved", columnList = "resolved")
})
public class SyncError {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 64)
    private EventType eventType;

    @Column(name = "tx_digest", nullable = false)
    private String txDigest;

    @Column(name = "event_seq", nullable = false, precision = 78, scale = 0)
    private BigInteger eventSeq;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload; // parsedJson

    @Column(name = "move_event_type")
    private String moveEventType;

    private String sender;

    @Column(name = "timestamp_ms")
    private Long timestampMs;

    @Column(name = "error_type", nullable = false)
    private String errorType;

    @Column(name = "error_message", nullable = false, columnDefinition = "TEXT")
    private String errorMessage;

    // Replay attempts only; a repeat failure seen by the poll loop does not count
    @Column(name = "retry_count", nullable = false)
    private Integer retryCount = 0;

    @Column(nullable = false)
    private Boolean resolved = false;

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
