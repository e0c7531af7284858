package com.suipatreon.indexer.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.suipatreon.indexer.config.IndexerProperties;
import com.suipatreon.indexer.entity.SyncError;
import com.suipatreon.indexer.repository.SyncErrorRepository;
import com.suipatreon.indexer.sui.EventId;
import com.suipatreon.indexer.sui.SuiEvent;
import com.suipatreon.indexer.sync.EventHandler;
import com.suipatreon.indexer.sync.EventTracker;
import com.suipatreon.indexer.sync.EventTrackerRegistry;
import com.suipatreon.indexer.sync.EventType;
import com.suipatreon.indexer.util.DependencyNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class DeadLetterServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SyncErrorRepository repository;
    private EventTrackerRegistry registry;
    private IndexerProperties properties;
    private DeadLetterService service;

    @BeforeEach
    void setUp() {
        repository = mock(SyncErrorRepository.class);
        registry = mock(EventTrackerRegistry.class);
        properties = new IndexerProperties();
        service = new DeadLetterService(repository, registry, properties, objectMapper);
        when(repository.save(any(SyncError.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void firstFailureStoresPayload() throws Exception {
        when(repository.findByEventTypeAndTxDigestAndEventSeq(any(), any(), any())).thenReturn(Optional.empty());

        service.record(EventType.CONTENT_CREATED, event(), new DependencyNotFoundException("Missing tiers: 0xtier2"));

        ArgumentCaptor<SyncError> captor = ArgumentCaptor.forClass(SyncError.class);
        verify(repository).save(captor.capture());
        SyncError row = captor.getValue();
        assertEquals(EventType.CONTENT_CREATED, row.getEventType());
        assertEquals("0xtx5", row.getTxDigest());
        assertEquals(BigInteger.valueOf(5), row.getEventSeq());
        assertEquals("DependencyNotFoundException", row.getErrorType());
        assertEquals("Missing tiers: 0xtier2", row.getErrorMessage());
        assertEquals(0, row.getRetryCount());
        assertFalse(row.getResolved());
        assertEquals("0xpkg::content::ContentCreated", row.getMoveEventType());
        assertEquals("0xcreator1", row.getSender());
        assertEquals(1_700_000_000_000L, row.getTimestampMs());
        assertEquals("0xcontent1", objectMapper.readTree(row.getPayload()).get("content_id").asText());
    }

    @Test
    void repeatedFailureReopensRowWithoutSpendingReplayAttempts() throws Exception {
        SyncError existing = pendingRow();
        existing.setRetryCount(2);
        existing.setResolved(true);
        when(repository.findByEventTypeAndTxDigestAndEventSeq(EventType.CONTENT_CREATED, "0xtx5", BigInteger.valueOf(5)))
                .thenReturn(Optional.of(existing));

        service.record(EventType.CONTENT_CREATED, event(), new IllegalStateException("still broken"));

        assertEquals(2, existing.getRetryCount());
        assertFalse(existing.getResolved());
        assertEquals("still broken", existing.getErrorMessage());
        verify(repository).save(existing);
    }

    @Test
    void storeFailureIsNotPropagated() throws Exception {
        when(repository.findByEventTypeAndTxDigestAndEventSeq(any(), any(), any()))
                .thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(() -> service.record(EventType.CONTENT_CREATED, event(), new RuntimeException("boom")));
    }

    @Test
    void successfulReplayResolvesRow() throws Exception {
        List<SuiEvent> replayed = new ArrayList<>();
        registerHandler((event, txDigest, eventSeq) -> replayed.add(event));
        SyncError row = pendingRow();

        assertTrue(service.replay(row));

        assertTrue(row.getResolved());
        assertEquals(1, replayed.size());
        assertEquals("0xtx5", replayed.get(0).getTxDigest());
        assertEquals("0xcontent1", replayed.get(0).getParsedJson().get("content_id").asText());
        assertEquals(1_700_000_000_000L, replayed.get(0).getTimestampMs());
        assertEquals("0xpkg::content::ContentCreated", replayed.get(0).getType());
        assertEquals("0xcreator1", replayed.get(0).getSender());
    }

    @Test
    void failedReplayIncrementsRetryCount() throws Exception {
        registerHandler((event, txDigest, eventSeq) -> {
            throw new DependencyNotFoundException("Missing tiers: 0xtier2");
        });
        SyncError row = pendingRow();

        assertFalse(service.replay(row));

        assertFalse(row.getResolved());
        assertEquals(1, row.getRetryCount());
        verify(repository).save(row);
    }

    @Test
    void unreadablePayloadCountsAsFailedReplay() throws Exception {
        registerHandler((event, txDigest, eventSeq) -> fail("handler must not run"));
        SyncError row = pendingRow();
        row.setPayload("{not json");

        assertFalse(service.replay(row));
        assertEquals(1, row.getRetryCount());
    }

    @Test
    void sweepSkipsWhenDisabled() {
        properties.getDeadLetter().setEnabled(false);

        service.replayUnresolved();

        verifyNoInteractions(repository);
    }

    @Test
    void sweepReplaysPendingRows() throws Exception {
        registerHandler((event, txDigest, eventSeq) -> { });
        SyncError row = pendingRow();
        when(repository.findByResolvedFalseAndRetryCountLessThanOrderByIdAsc(anyInt())).thenReturn(List.of(row));

        service.replayUnresolved();

        verify(repository).findByResolvedFalseAndRetryCountLessThanOrderByIdAsc(10);
        assertTrue(row.getResolved());
    }

    private void registerHandler(EventHandler handler) {
        when(registry.find(EventType.CONTENT_CREATED)).thenReturn(Optional.of(
                new EventTracker(EventType.CONTENT_CREATED, "0xpkg::content::ContentCreated", handler)));
    }

    private SuiEvent event() throws Exception {
        return SuiEvent.builder()
                .id(new EventId("0xtx5", BigInteger.valueOf(5)))
                .type("0xpkg::content::ContentCreated")
                .sender("0xcreator1")
                .timestampMs(1_700_000_000_000L)
                .parsedJson(objectMapper.readTree("""
                        {"content_id": "0xcontent1", "creator": "0xcreator1", "tier_ids": ["0xtier2"]}
                        """))
                .build();
    }

    private SyncError pendingRow() throws Exception {
        SyncError row = new SyncError();
        row.setId(1L);
        row.setEventType(EventType.CONTENT_CREATED);
        row.setTxDigest("0xtx5");
        row.setEventSeq(BigInteger.valueOf(5));
        SuiEvent event = event();
        row.setPayload(event.getParsedJson().toString());
        row.setMoveEventType(event.getType());
        row.setSender(event.getSender());
        row.setTimestampMs(event.getTimestampMs());
        row.setErrorType("DependencyNotFoundException");
        row.setErrorMessage("Missing tiers: 0xtier2");
        return row;
    }
}
