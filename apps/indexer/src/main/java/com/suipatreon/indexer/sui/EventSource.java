package com.suipatreon.indexer.sui;

/**
 * Bounded, ascending pull query over events of one Move event type.
 * Delivery is at-least-once: the same event can come back after a cursor reset.
 */
public interface EventSource {

    /**
     * @param moveEventType fully qualified Move event type to filter on
     * @param cursor        exclusive start position, null to start from the first event
     * @param limit         maximum number of events in the page
     * @throws SuiRpcException when the node rejects the query or cannot be reached
     */
    EventPage queryEvents(String moveEventType, EventId cursor, int limit);
}
