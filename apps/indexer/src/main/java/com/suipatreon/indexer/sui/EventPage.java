package com.suipatreon.indexer.sui;

import lombok.Value;

import java.util.List;

@Value
public class EventPage {

    List<SuiEvent> data;

    /**
     * Cursor to continue from, null when the node returned none.
     */
    EventId nextCursor;

    boolean hasNextPage;

    public static EventPage empty() {
        return new EventPage(List.of(), null, false);
    }
}
