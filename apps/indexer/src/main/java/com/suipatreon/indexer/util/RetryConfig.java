package com.suipatreon.indexer.util;

import lombok.Builder;
import lombok.Value;

/**
 * Exponential backoff settings for {@link RetryUtils}.
 */
@Value
@Builder(toBuilder = true)
public class RetryConfig {

    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final long DEFAULT_INITIAL_DELAY_MS = 1000;
    public static final long DEFAULT_MAX_DELAY_MS = 10000;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    @Builder.Default
    int maxRetries = DEFAULT_MAX_RETRIES;

    @Builder.Default
    long initialDelayMs = DEFAULT_INITIAL_DELAY_MS;

    @Builder.Default
    long maxDelayMs = DEFAULT_MAX_DELAY_MS;

    @Builder.Default
    double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;

    public static RetryConfig defaults() {
        return RetryConfig.builder().build();
    }
}
