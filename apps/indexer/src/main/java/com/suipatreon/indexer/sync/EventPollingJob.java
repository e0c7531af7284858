package com.suipatreon.indexer.sync;

import com.suipatreon.indexer.entity.IndexerCheckpoint;
import com.suipatreon.indexer.service.CheckpointService;
import com.suipatreon.indexer.service.DeadLetterService;
import com.suipatreon.indexer.sui.EventId;
import com.suipatreon.indexer.sui.EventPage;
import com.suipatreon.indexer.sui.EventSource;
import com.suipatreon.indexer.sui.SuiEvent;
import com.suipatreon.indexer.sui.SuiRpcException;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Polling cycle for one tracked event type.
 *
 * <p>Each run fetches one page after the in-memory cursor, dispatches the events in
 * order, persists the checkpoint and reschedules itself: immediately while the node
 * reports more pages, otherwise after the poll interval. Only one run of a job is ever
 * scheduled at a time, so cursor and watermark are confined to that run.
 */
@Slf4j
public class EventPollingJob implements Runnable {

    private final EventTracker tracker;
    private final EventSource eventSource;
    private final CheckpointService checkpointService;
    private final DeadLetterService deadLetterService;
    private final Tracer tracer;
    private final TaskScheduler scheduler;
    private final int queryLimit;
    private final Duration pollInterval;

    private final Object scheduleLock = new Object();
    private ScheduledFuture<?> nextRun;
    private boolean stopped;

    private volatile EventId cursor;
    private volatile BigInteger lastProcessedSeq;

    public EventPollingJob(EventTracker tracker,
                           EventSource eventSource,
                           CheckpointService checkpointService,
                           DeadLetterService deadLetterService,
                           Tracer tracer,
                           TaskScheduler scheduler,
                           int queryLimit,
                           Duration pollInterval,
                           IndexerCheckpoint checkpoint) {
        this.tracker = tracker;
        this.eventSource = eventSource;
        this.checkpointService = checkpointService;
        this.deadLetterService = deadLetterService;
        this.tracer = tracer;
        this.scheduler = scheduler;
        this.queryLimit = queryLimit;
        this.pollInterval = pollInterval;
        if (checkpoint != null) {
            this.cursor = new EventId(checkpoint.getLastTxDigest(), checkpoint.getLastEventSeq());
            this.lastProcessedSeq = checkpoint.getLastEventSeq();
        }
    }

    public EventType getType() {
        return tracker.getType();
    }

    public EventId getCursor() {
        return cursor;
    }

    public BigInteger getLastProcessedSeq() {
        return lastProcessedSeq;
    }

    public void start() {
        log.info("[{}] Starting event polling...", getType());
        schedule(Duration.ZERO);
    }

    /**
     * Stop scheduling. A page that is already running finishes.
     */
    public void stop() {
        synchronized (scheduleLock) {
            stopped = true;
            if (nextRun != null) {
                nextRun.cancel(false);
            }
        }
    }

    @Override
    public void run() {
        PollResult result;
        try {
            result = executeOnce();
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error in poll cycle: {}", getType(), e.getMessage(), e);
            result = idle();
        }
        schedule(result.isHasNextPage() ? Duration.ZERO : pollInterval);
    }

    /**
     * Fetch and dispatch one page
     */
    public PollResult executeOnce() {
        EventType type = getType();
        Span span = tracer.spanBuilder("EventPollingJob.poll")
                .setAttribute("event.type", type.name())
                .startSpan();
        try {
            EventPage page;
            try {
                page = eventSource.queryEvents(tracker.getMoveEventType(), cursor, queryLimit);
            } catch (SuiRpcException e) {
                span.recordException(e);
                if (e.isInvalidParams()) {
                    // Watermark stays, so the re-scan skips everything already checkpointed
                    log.warn("[{}] Invalid cursor {} rejected by node, resetting to start from beginning",
                            type, cursor);
                    cursor = null;
                } else {
                    log.error("[{}] Error querying events: {}", type, e.getMessage(), e);
                }
                return idle();
            }

            BigInteger startSeq = lastProcessedSeq;
            BigInteger watermark = startSeq;
            String watermarkTx = null;
            int processed = 0;
            List<HandlerOutcome> failures = new ArrayList<>();

            for (SuiEvent event : page.getData()) {
                BigInteger eventSeq = event.getEventSeq();
                if (startSeq != null && eventSeq.compareTo(startSeq) <= 0) {
                    log.debug("[{}] Skipping already processed event seq {}", type, eventSeq);
                    continue;
                }

                log.info("[{}] Processing event seq {}, tx {}", type, eventSeq, event.getTxDigest());
                HandlerOutcome outcome = HandlerOutcome.dispatch(tracker.getHandler(), event);
                if (outcome.isSucceeded()) {
                    processed++;
                    if (watermark == null || eventSeq.compareTo(watermark) > 0) {
                        watermark = eventSeq;
                        watermarkTx = event.getTxDigest();
                    }
                } else {
                    failures.add(outcome);
                    log.error("[{}] Error processing event seq {}, tx {}: {}",
                            type, eventSeq, event.getTxDigest(), outcome.getError().getMessage(), outcome.getError());
                }
            }

            if (watermarkTx != null) {
                try {
                    checkpointService.updateCheckpoint(type, watermark, watermarkTx);
                } catch (RuntimeException e) {
                    span.recordException(e);
                    log.error("[{}] Failed to persist checkpoint at seq {}, page will be polled again: {}",
                            type, watermark, e.getMessage(), e);
                    return idle();
                }
            }

            // Only once the page is committed; a re-fetched page would record its failures twice
            for (HandlerOutcome failure : failures) {
                deadLetterService.record(type, failure.getEvent(), failure.getError());
            }
            int failed = failures.size();

            lastProcessedSeq = watermark;
            if (page.getNextCursor() != null && !page.getData().isEmpty()) {
                cursor = page.getNextCursor();
            }
            if (processed > 0 || failed > 0) {
                log.info("[{}] Page done: {} processed, {} failed, watermark {}", type, processed, failed, watermark);
            }
            return new PollResult(cursor, page.isHasNextPage(), lastProcessedSeq, processed, failed);
        } finally {
            span.end();
        }
    }

    private PollResult idle() {
        return new PollResult(cursor, false, lastProcessedSeq, 0, 0);
    }

    private void schedule(Duration delay) {
        synchronized (scheduleLock) {
            if (stopped) {
                return;
            }
            try {
                nextRun = scheduler.schedule(this, Instant.now().plus(delay));
            } catch (TaskRejectedException e) {
                log.warn("[{}] Scheduler rejected next poll, stopping: {}", getType(), e.getMessage());
                stopped = true;
            }
        }
    }
}
