package com.suipatreon.indexer.service;

import com.suipatreon.indexer.entity.IndexerCheckpoint;
import com.suipatreon.indexer.repository.IndexerCheckpointRepository;
import com.suipatreon.indexer.sync.EventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Service for managing indexer checkpoints (last processed event per event type)
 */
@Slf4j
@Service
@Transactional
public class CheckpointService {

    private final IndexerCheckpointRepository checkpointRepository;

    public CheckpointService(IndexerCheckpointRepository checkpointRepository) {
        this.checkpointRepository = checkpointRepository;
    }

    /**
     * Get the checkpoint for an event type, empty if it was never checkpointed
     */
    @Transactional(readOnly = true)
    public Optional<IndexerCheckpoint> getCheckpoint(EventType eventType) {
        Optional<IndexerCheckpoint> checkpoint = checkpointRepository.findByEventType(eventType);
        checkpoint.ifPresent(c -> log.info("[Checkpoint] Resuming {} from sequence {}, tx {}",
                eventType, c.getLastEventSeq(), c.getLastTxDigest()));
        return checkpoint;
    }

    /**
     * Create or overwrite the checkpoint. Callers only pass advancing sequences.
     */
    public IndexerCheckpoint updateCheckpoint(EventType eventType, BigInteger eventSeq, String txDigest) {
        IndexerCheckpoint checkpoint = checkpointRepository.findByEventType(eventType)
                .orElseGet(() -> {
                    IndexerCheckpoint created = new IndexerCheckpoint();
                    created.setEventType(eventType);
                    return created;
                });
        checkpoint.setLastEventSeq(eventSeq);
        checkpoint.setLastTxDigest(txDigest);
        IndexerCheckpoint saved = checkpointRepository.save(checkpoint);
        log.debug("[Checkpoint] {} advanced to sequence {}, tx {}", eventType, eventSeq, txDigest);
        return saved;
    }
}
