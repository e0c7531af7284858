package com.suipatreon.indexer.repository;

import com.suipatreon.indexer.entity.IndexerCheckpoint;
import com.suipatreon.indexer.sync.EventType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface IndexerCheckpointRepository extends JpaRepository<IndexerCheckpoint, UUID> {

    Optional<IndexerCheckpoint> findByEventType(EventType eventType);
}
