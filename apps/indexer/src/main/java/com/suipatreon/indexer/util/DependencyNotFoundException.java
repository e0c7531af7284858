package com.suipatreon.indexer.util;

/**
 * Raised by a handler when an entity its event refers to has not been indexed yet.
 * Events of different types are polled independently, so a child event can be
 * seen before its parent; this is the retryable condition for {@link RetryUtils}.
 */
public class DependencyNotFoundException extends Exception {

    public DependencyNotFoundException(String message) {
        super(message);
    }
}
