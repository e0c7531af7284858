package com.suipatreon.indexer.service;

import com.suipatreon.indexer.entity.IndexerCheckpoint;
import com.suipatreon.indexer.repository.IndexerCheckpointRepository;
import com.suipatreon.indexer.sync.EventType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(CheckpointService.class)
class CheckpointServiceTest {

    @Autowired
    private CheckpointService checkpointService;

    @Autowired
    private IndexerCheckpointRepository checkpointRepository;

    @Test
    void unknownEventTypeHasNoCheckpoint() {
        assertTrue(checkpointService.getCheckpoint(EventType.PROFILE_CREATED).isEmpty());
    }

    @Test
    void updateCreatesThenOverwrites() {
        checkpointService.updateCheckpoint(EventType.TIER_CREATED, BigInteger.valueOf(100), "0xtx100");
        checkpointService.updateCheckpoint(EventType.TIER_CREATED, BigInteger.valueOf(101), "0xtx101");

        assertEquals(1, checkpointRepository.count());
        IndexerCheckpoint checkpoint = checkpointService.getCheckpoint(EventType.TIER_CREATED).orElseThrow();
        assertEquals(BigInteger.valueOf(101), checkpoint.getLastEventSeq());
        assertEquals("0xtx101", checkpoint.getLastTxDigest());
        assertNotNull(checkpoint.getCreatedAt());
        assertNotNull(checkpoint.getUpdatedAt());
    }

    @Test
    void eventTypesAreCheckpointedIndependently() {
        checkpointService.updateCheckpoint(EventType.PROFILE_CREATED, BigInteger.valueOf(7), "0xtx7");
        checkpointService.updateCheckpoint(EventType.CONTENT_CREATED, BigInteger.valueOf(3), "0xtx3");

        assertEquals(BigInteger.valueOf(7),
                checkpointService.getCheckpoint(EventType.PROFILE_CREATED).orElseThrow().getLastEventSeq());
        assertEquals(BigInteger.valueOf(3),
                checkpointService.getCheckpoint(EventType.CONTENT_CREATED).orElseThrow().getLastEventSeq());
        assertTrue(checkpointService.getCheckpoint(EventType.TIER_DEACTIVATED).isEmpty());
    }

    @Test
    void sequenceBeyondLongRangeRoundTrips() {
        BigInteger seq = new BigInteger("340282366920938463463374607431768211455");
        checkpointService.updateCheckpoint(EventType.SUBSCRIPTION_PURCHASED, seq, "0xtxbig");

        assertEquals(seq, checkpointService.getCheckpoint(EventType.SUBSCRIPTION_PURCHASED)
                .orElseThrow().getLastEventSeq());
    }
}
