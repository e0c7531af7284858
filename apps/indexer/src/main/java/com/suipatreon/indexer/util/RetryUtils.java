package com.suipatreon.indexer.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * Retry utility for exponential backoff strategy
 */
public final class RetryUtils {

    private static final Logger logger = LoggerFactory.getLogger(RetryUtils.class);

    private RetryUtils() {
    }

    /**
     * Execute with exponential backoff retry
     *
     * @param task        Task to execute
     * @param isRetryable Decides whether a failure is worth another attempt
     * @param config      Backoff settings, {@code maxRetries + 1} attempts in total
     * @param <T>         Return type
     * @return Result from task execution
     * @throws Exception The first non-retryable failure, or the last failure once retries are exhausted
     */
    public static <T> T executeWithRetry(
            RetryableTask<T> task,
            Predicate<Exception> isRetryable,
            RetryConfig config
    ) throws Exception {
        long delayMs = Math.min(config.getInitialDelayMs(), config.getMaxDelayMs());

        for (int attempt = 0; ; attempt++) {
            try {
                return task.execute();
            } catch (Exception e) {
                if (attempt >= config.getMaxRetries() || !isRetryable.test(e)) {
                    if (attempt > 0) {
                        logger.error("Giving up after {} attempt(s): {}", attempt + 1, e.getMessage());
                    }
                    throw e;
                }
                logger.warn("Retry attempt {}/{} failed, waiting {}ms before retry: {}",
                        attempt + 1, config.getMaxRetries(), delayMs, e.getMessage());
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ie;
                }
                delayMs = Math.min((long) (delayMs * config.getBackoffMultiplier()), config.getMaxDelayMs());
            }
        }
    }

    /**
     * Execute with the default backoff settings
     */
    public static <T> T executeWithRetry(
            RetryableTask<T> task,
            Predicate<Exception> isRetryable
    ) throws Exception {
        return executeWithRetry(task, isRetryable, RetryConfig.defaults());
    }

    public static boolean isDependencyNotFound(Exception e) {
        return e instanceof DependencyNotFoundException;
    }

    /**
     * Functional interface for retryable task
     */
    @FunctionalInterface
    public interface RetryableTask<T> {
        T execute() throws Exception;
    }
}
