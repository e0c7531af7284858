package com.suipatreon.indexer.util;

import java.math.BigInteger;

/**
 * Ordering checks for events that overwrite state set by an earlier event of the same type.
 */
public final class EventSequences {

    private EventSequences() {
    }

    /**
     * True when an event of the same type with sequence {@code applied} or later already
     * wrote this row, so {@code eventSeq} must not overwrite it. Unknown sequences never count as stale.
     */
    public static boolean isStale(BigInteger eventSeq, BigInteger applied) {
        return eventSeq != null && applied != null && eventSeq.compareTo(applied) <= 0;
    }
}
