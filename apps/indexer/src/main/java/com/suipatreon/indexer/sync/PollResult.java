package com.suipatreon.indexer.sync;

import com.suipatreon.indexer.sui.EventId;
import lombok.Value;

import java.math.BigInteger;

/**
 * State after one poll cycle: where the next query continues from and whether to poll again right away.
 */
@Value
public class PollResult {

    EventId cursor;
    boolean hasNextPage;
    BigInteger lastProcessedSeq;

    /**
     * Number of handlers that ran to completion in this cycle.
     */
    int processed;

    /**
     * Number of handlers that failed in this cycle.
     */
    int failed;
}
