package com.suipatreon.indexer.sync;

import com.suipatreon.indexer.config.IndexerProperties;
import com.suipatreon.indexer.entity.IndexerCheckpoint;
import com.suipatreon.indexer.service.CheckpointService;
import com.suipatreon.indexer.service.DeadLetterService;
import com.suipatreon.indexer.sui.EventSource;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Starts one polling job per tracked event type and drains them on shutdown.
 */
@Slf4j
@Service
public class EventIndexerService {

    private final IndexerProperties properties;
    private final EventTrackerRegistry trackerRegistry;
    private final EventSource eventSource;
    private final CheckpointService checkpointService;
    private final DeadLetterService deadLetterService;
    private final Tracer tracer;
    private final ThreadPoolTaskScheduler scheduler;
    private final List<EventPollingJob> jobs = new CopyOnWriteArrayList<>();

    public EventIndexerService(IndexerProperties properties,
                               EventTrackerRegistry trackerRegistry,
                               EventSource eventSource,
                               CheckpointService checkpointService,
                               DeadLetterService deadLetterService,
                               Tracer tracer,
                               ThreadPoolTaskScheduler indexerTaskScheduler) {
        this.properties = properties;
        this.trackerRegistry = trackerRegistry;
        this.eventSource = eventSource;
        this.checkpointService = checkpointService;
        this.deadLetterService = deadLetterService;
        this.tracer = tracer;
        this.scheduler = indexerTaskScheduler;
    }

    /**
     * Resume every event type from its checkpoint. Failures here are fatal: the
     * exception escapes and the application context is closed.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        Span span = tracer.spanBuilder("EventIndexerService.start").startSpan();
        try {
            String packageId = properties.getPackageId();
            if (packageId == null || packageId.isBlank()) {
                throw new IllegalStateException("indexer.package-id (PACKAGE_ID) is required");
            }

            log.info("============================================================");
            log.info("[Indexer] Sui Patreon Event Indexer Starting...");
            log.info("[Indexer] Package ID: {}", packageId);
            log.info("[Indexer] Network: {}", properties.getNetwork());
            log.info("[Indexer] Poll Interval: {}ms", properties.getPollIntervalMs());
            log.info("[Indexer] Query Limit: {} events per query", properties.getQueryLimit());
            log.info("============================================================");

            // Read every checkpoint before anything is scheduled
            List<EventPollingJob> created = new ArrayList<>();
            for (EventTracker tracker : trackerRegistry.getTrackers()) {
                IndexerCheckpoint checkpoint = checkpointService.getCheckpoint(tracker.getType()).orElse(null);
                created.add(new EventPollingJob(
                        tracker,
                        eventSource,
                        checkpointService,
                        deadLetterService,
                        tracer,
                        scheduler,
                        properties.getQueryLimit(),
                        Duration.ofMillis(properties.getPollIntervalMs()),
                        checkpoint));
            }
            log.info("[Indexer] Database connection established, {} checkpoint(s) checked", created.size());

            jobs.addAll(created);
            jobs.forEach(EventPollingJob::start);
            log.info("[Indexer] Indexer is running with {} event type(s)", jobs.size());
        } catch (RuntimeException e) {
            span.recordException(e);
            log.error("[Indexer] Failed to start indexer: {}", e.getMessage(), e);
            throw e;
        } finally {
            span.end();
        }
    }

    public List<EventPollingJob> getJobs() {
        return List.copyOf(jobs);
    }

    /**
     * Stop scheduling and wait for in-flight pages. The data source is closed by the
     * container after this bean is destroyed.
     */
    @PreDestroy
    public void shutdown() {
        log.info("[Indexer] Shutting down gracefully...");
        jobs.forEach(EventPollingJob::stop);
        scheduler.shutdown();
        log.info("[Indexer] Cleanup complete");
    }
}
