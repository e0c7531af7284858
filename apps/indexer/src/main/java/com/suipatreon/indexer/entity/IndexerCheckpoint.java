package com.suipatreon.indexer.entity;

import com.suipatreon.indexer.sync.EventType;
import jakarta.persistence.*;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Last processed event per tracked event type. Read at startup to resume polling.
 */
@Entity
@Table(name = "indexer_checkpoint", uniqueConstraints = {
        @UniqueConstraint(name = "uq_indexer_checkpoint_event_type", columnNames = "event_type")
})
public class IndexerCheckpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 64)
    private EventType eventType;

    @Column(name = "last_event_seq", nullable = false, precision = 78, scale = 0)
    private BigInteger lastEventSeq;

    @Column(name = "last_tx_digest", nullable = false)
    private String lastTxDigest;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    public void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    public void touchUpdatedAt() {
        this.updatedAt = Instant.now();
    }

    // getters and setters
    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public BigInteger getLastEventSeq() {
        return lastEventSeq;
    }

    public void setLastEventSeq(BigInteger lastEventSeq) {
        this.lastEventSeq = lastEventSeq;
    }

    public String getLastTxDigest() {
        return lastTxDigest;
    }

    public void setLastTxDigest(String lastTxDigest) {
        this.lastTxDigest = lastTxDigest;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
