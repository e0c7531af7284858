package com.suipatreon.indexer.sui;

import lombok.NonNull;
import lombok.Value;

import java.math.BigInteger;

/**
 * Position of an event on chain; also the continuation cursor for event queries.
 */
@Value
public class EventId {

    @NonNull
    String txDigest;

    @NonNull
    BigInteger eventSeq;
}
