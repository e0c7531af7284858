package com.suipatreon.indexer.sync;

import lombok.NonNull;
import lombok.Value;

/**
 * Binds a tracked event type to its query filter and handler.
 */
@Value
public class EventTracker {

    @NonNull
    EventType type;

    /**
     * Fully qualified {@code MoveEventType} to query.
     */
    @NonNull
    String moveEventType;

    @NonNull
    EventHandler handler;
}
