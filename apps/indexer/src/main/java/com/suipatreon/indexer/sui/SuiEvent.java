package com.suipatreon.indexer.sui;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class SuiEvent {

    @NonNull
    EventId id;

    /**
     * Fully qualified Move event type, {@code <package>::<module>::<Event>}.
     */
    String type;

    String sender;

    @NonNull
    JsonNode parsedJson;

    Long timestampMs;

    public String getTxDigest() {
        return id.getTxDigest();
    }

    public BigInteger getEventSeq() {
        return id.getEventSeq();
    }
}
