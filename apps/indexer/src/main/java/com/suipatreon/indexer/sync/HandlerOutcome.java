package com.suipatreon.indexer.sync;

import com.suipatreon.indexer.sui.SuiEvent;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigInteger;

/**
 * Result of dispatching one event. The poll loop folds outcomes into the watermark
 * instead of letting handler exceptions escape the page.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class HandlerOutcome {

    public enum Status {
        SUCCEEDED,
        FAILED
    }

    Status status;
    SuiEvent event;
    Exception error;

    public static HandlerOutcome succeeded(SuiEvent event) {
        return new HandlerOutcome(Status.SUCCEEDED, event, null);
    }

    public static HandlerOutcome failed(SuiEvent event, Exception error) {
        return new HandlerOutcome(Status.FAILED, event, error);
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }

    public BigInteger getEventSeq() {
        return event.getEventSeq();
    }

    /**
     * Runs the handler and captures the result.
     */
    public static HandlerOutcome dispatch(EventHandler handler, SuiEvent event) {
        try {
            handler.handle(event, event.getTxDigest(), event.getEventSeq());
            return succeeded(event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(event, e);
        } catch (Exception e) {
            return failed(event, e);
        }
    }
}
