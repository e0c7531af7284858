package com.suipatreon.indexer.sync;

import com.suipatreon.indexer.sui.SuiEvent;

import java.math.BigInteger;

/**
 * Applies one event to the store. Implementations must be idempotent: the poll loop
 * delivers at least once.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(SuiEvent event, String txDigest, BigInteger eventSeq) throws Exception;
}
