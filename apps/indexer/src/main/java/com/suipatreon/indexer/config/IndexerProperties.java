package com.suipatreon.indexer.config;

import com.suipatreon.indexer.util.RetryConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Indexer configuration. Read once at startup; changes need a restart.
 */
@Component
@ConfigurationProperties(prefix = "indexer")
public class IndexerProperties {

    /**
     * Published package whose events are indexed.
     */
    private String packageId;

    /**
     * mainnet, testnet, devnet or localnet.
     */
    private String network = "testnet";

    /**
     * Explicit fullnode URL; overrides the network default when set.
     */
    private String rpcUrl;

    /**
     * Delay between polls once an event type has caught up (ms).
     */
    private long pollIntervalMs = 5_000;

    /**
     * Events requested per query.
     */
    private int queryLimit = 50;

    /**
     * How long shutdown waits for in-flight pages.
     */
    private int shutdownTimeoutSeconds = 30;

    /**
     * Backoff used by handlers waiting for a parent entity.
     */
    private Retry retry = new Retry();

    private DeadLetter deadLetter = new DeadLetter();

    public String getPackageId() {
        return packageId;
    }

    public void setPackageId(String packageId) {
        this.packageId = packageId;
    }

    public String getNetwork() {
        return network;
    }

    public void setNetwork(String network) {
        this.network = network;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public int getQueryLimit() {
        return queryLimit;
    }

    public void setQueryLimit(int queryLimit) {
        this.queryLimit = queryLimit;
    }

    public int getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public void setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public DeadLetter getDeadLetter() {
        return deadLetter;
    }

    public void setDeadLetter(DeadLetter deadLetter) {
        this.deadLetter = deadLetter;
    }

    public static class Retry {
        private int maxRetries = RetryConfig.DEFAULT_MAX_RETRIES;
        private long initialDelayMs = RetryConfig.DEFAULT_INITIAL_DELAY_MS;
        private long maxDelayMs = RetryConfig.DEFAULT_MAX_DELAY_MS;
        private double backoffMultiplier = RetryConfig.DEFAULT_BACKOFF_MULTIPLIER;

        public RetryConfig toRetryConfig() {
            return RetryConfig.builder()
                    .maxRetries(maxRetries)
                    .initialDelayMs(initialDelayMs)
                    .maxDelayMs(maxDelayMs)
                    .backoffMultiplier(backoffMultiplier)
                    .build();
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }
    }

    public static class DeadLetter {
        private boolean enabled = true;
        /**
         * Interval of the replay sweep over unresolved failures (ms).
         */
        private long replayIntervalMs = 60_000;
        /**
         * Rows are left alone once they failed this many times.
         */
        private int maxReplayAttempts = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getReplayIntervalMs() {
            return replayIntervalMs;
        }

        public void setReplayIntervalMs(long replayIntervalMs) {
            this.replayIntervalMs = replayIntervalMs;
        }

        public int getMaxReplayAttempts() {
            return maxReplayAttempts;
        }

        public void setMaxReplayAttempts(int maxReplayAttempts) {
            this.maxReplayAttempts = maxReplayAttempts;
        }
    }
}
