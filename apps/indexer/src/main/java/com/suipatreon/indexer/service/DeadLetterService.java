package com.suipatreon.indexer.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.suipatreon.indexer.config.IndexerProperties;
import com.suipatreon.indexer.entity.SyncError;
import com.suipatreon.indexer.repository.SyncErrorRepository;
import com.suipatreon.indexer.sui.EventId;
import com.suipatreon.indexer.sui.SuiEvent;
import com.suipatreon.indexer.sync.EventTracker;
import com.suipatreon.indexer.sync.EventTrackerRegistry;
import com.suipatreon.indexer.sync.EventType;
import com.suipatreon.indexer.sync.HandlerOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Keeps events whose handler gave up, and replays them on a schedule.
 *
 * <p>The poll loop moves past a failed event once a later one succeeds, so without this
 * log a permanently missing dependency would go unnoticed.
 */
@Slf4j
@Service
public class DeadLetterService {

    private static final int MAX_MESSAGE_LENGTH = 4000;

    private final SyncErrorRepository syncErrorRepository;
    private final EventTrackerRegistry trackerRegistry;
    private final IndexerProperties properties;
    private final ObjectMapper objectMapper;

    public DeadLetterService(SyncErrorRepository syncErrorRepository,
                             EventTrackerRegistry trackerRegistry,
                             IndexerProperties properties,
                             ObjectMapper objectMapper) {
        this.syncErrorRepository = syncErrorRepository;
        this.trackerRegistry = trackerRegistry;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Record a failed event. A repeat failure of the same event refreshes the error and
     * reopens the row; only replays count towards the retry count.
     * Never throws; the poll loop must keep going when the store is unhealthy.
     */
    public void record(EventType eventType, SuiEvent event, Exception error) {
        try {
            SyncError row = syncErrorRepository
                    .findByEventTypeAndTxDigestAndEventSeq(eventType, event.getTxDigest(), event.getEventSeq())
                    .map(existing -> {
                        existing.setResolved(false);
                        return existing;
                    })
                    .orElseGet(() -> {
                        SyncError created = new SyncError();
                        created.setEventType(eventType);
                        created.setTxDigest(event.getTxDigest());
                        created.setEventSeq(event.getEventSeq());
                        created.setPayload(event.getParsedJson().toString());
                        created.setMoveEventType(event.getType());
                        created.setSender(event.getSender());
                        created.setTimestampMs(event.getTimestampMs());
                        return created;
                    });
            row.setErrorType(error.getClass().getSimpleName());
            row.setErrorMessage(truncate(String.valueOf(error.getMessage())));
            syncErrorRepository.save(row);
        } catch (Exception e) {
            log.error("[{}] Could not record failed event seq {}, tx {}: {}",
                    eventType, event.getEventSeq(), event.getTxDigest(), e.getMessage(), e);
        }
    }

    /**
     * Replay unresolved failures through their handlers
     */
    @Scheduled(
            initialDelayString = "${indexer.dead-letter.replay-interval-ms:60000}",
            fixedDelayString = "${indexer.dead-letter.replay-interval-ms:60000}"
    )
    public void replayUnresolved() {
        if (!properties.getDeadLetter().isEnabled()) {
            return;
        }
        List<SyncError> pending = syncErrorRepository
                .findByResolvedFalseAndRetryCountLessThanOrderByIdAsc(properties.getDeadLetter().getMaxReplayAttempts());
        if (pending.isEmpty()) {
            return;
        }
        log.info("Replaying {} failed event(s)", pending.size());

        int resolved = 0;
        for (SyncError row : pending) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            if (replay(row)) {
                resolved++;
            }
        }
        log.info("Replay finished: {} resolved, {} still failing", resolved, pending.size() - resolved);
    }

    boolean replay(SyncError row) {
        Optional<EventTracker> tracker = trackerRegistry.find(row.getEventType());
        if (tracker.isEmpty()) {
            log.warn("No tracker for {}, leaving failed event {} untouched", row.getEventType(), row.getId());
            return false;
        }

        HandlerOutcome outcome;
        try {
            SuiEvent event = SuiEvent.builder()
                    .id(new EventId(row.getTxDigest(), row.getEventSeq()))
                    .type(row.getMoveEventType())
                    .sender(row.getSender())
                    .parsedJson(objectMapper.readTree(row.getPayload()))
                    .timestampMs(row.getTimestampMs())
                    .build();
            outcome = HandlerOutcome.dispatch(tracker.get().getHandler(), event);
        } catch (Exception e) {
            log.error("[{}] Stored payload of failed event {} is unreadable", row.getEventType(), row.getId(), e);
            markFailed(row, e);
            return false;
        }

        if (outcome.isSucceeded()) {
            row.setResolved(true);
            syncErrorRepository.save(row);
            log.info("[{}] Replayed event seq {}, tx {}", row.getEventType(), row.getEventSeq(), row.getTxDigest());
            return true;
        }

        Exception error = outcome.getError();
        markFailed(row, error);
        log.warn("[{}] Replay of event seq {} failed again ({} attempts): {}",
                row.getEventType(), row.getEventSeq(), row.getRetryCount(), error.getMessage());
        return false;
    }

    private void markFailed(SyncError row, Exception error) {
        row.setRetryCount(row.getRetryCount() + 1);
        row.setErrorType(error.getClass().getSimpleName());
        row.setErrorMessage(truncate(String.valueOf(error.getMessage())));
        syncErrorRepository.save(row);
    }

    private static String truncate(String message) {
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH);
    }
}
