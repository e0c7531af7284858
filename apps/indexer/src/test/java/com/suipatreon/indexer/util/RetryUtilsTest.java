package com.suipatreon.indexer.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RetryUtilsTest {

    private static final RetryConfig FAST = RetryConfig.builder()
            .maxRetries(5)
            .initialDelayMs(10)
            .maxDelayMs(100)
            .build();

    @Test
    void defaultsMatchDocumentedValues() {
        RetryConfig config = RetryConfig.defaults();
        assertEquals(5, config.getMaxRetries());
        assertEquals(1000, config.getInitialDelayMs());
        assertEquals(10000, config.getMaxDelayMs());
        assertEquals(2.0, config.getBackoffMultiplier());
    }

    @Test
    void succeedsOnFirstAttempt() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        String result = RetryUtils.executeWithRetry(() -> {
            attempts.incrementAndGet();
            return "success";
        }, e -> true, FAST);

        assertEquals("success", result);
        assertEquals(1, attempts.get());
    }

    @Test
    void retriesRetryableErrorsUntilSuccess() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        String result = RetryUtils.executeWithRetry(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new DependencyNotFoundException("Not ready yet");
            }
            return "success";
        }, RetryUtils::isDependencyNotFound, FAST);

        assertEquals("success", result);
        assertEquals(3, attempts.get());
    }

    @Test
    void exhaustedRetriesPropagateAfterInitialPlusMaxRetriesAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        RetryConfig config = FAST.toBuilder().maxRetries(3).build();

        DependencyNotFoundException error = assertThrows(DependencyNotFoundException.class, () ->
                RetryUtils.executeWithRetry(() -> {
                    attempts.incrementAndGet();
                    throw new DependencyNotFoundException("Always fails");
                }, RetryUtils::isDependencyNotFound, config));

        assertEquals("Always fails", error.getMessage());
        assertEquals(4, attempts.get());
    }

    @Test
    void nonRetryableErrorIsThrownAfterOneAttempt() {
        AtomicInteger attempts = new AtomicInteger();

        IllegalStateException error = assertThrows(IllegalStateException.class, () ->
                RetryUtils.executeWithRetry(() -> {
                    attempts.incrementAndGet();
                    throw new IllegalStateException("Non-retryable error");
                }, RetryUtils::isDependencyNotFound, FAST));

        assertEquals("Non-retryable error", error.getMessage());
        assertEquals(1, attempts.get());
    }

    @Test
    void zeroRetriesMeansSingleAttempt() {
        AtomicInteger attempts = new AtomicInteger();
        RetryConfig config = FAST.toBuilder().maxRetries(0).build();

        assertThrows(DependencyNotFoundException.class, () ->
                RetryUtils.executeWithRetry(() -> {
                    attempts.incrementAndGet();
                    throw new DependencyNotFoundException("missing");
                }, RetryUtils::isDependencyNotFound, config));

        assertEquals(1, attempts.get());
    }

    @Test
    void delaysGrowExponentially() {
        List<Long> delays = recordDelays(RetryConfig.builder()
                .maxRetries(3)
                .initialDelayMs(50)
                .backoffMultiplier(2)
                .maxDelayMs(500)
                .build());

        assertEquals(3, delays.size());
        assertTrue(delays.get(0) >= 50, "first delay " + delays.get(0));
        assertTrue(delays.get(1) >= 100, "second delay " + delays.get(1));
        assertTrue(delays.get(2) >= 200, "third delay " + delays.get(2));
    }

    @Test
    void delaysAreCappedAtMaxDelay() {
        List<Long> delays = recordDelays(RetryConfig.builder()
                .maxRetries(5)
                .initialDelayMs(100)
                .backoffMultiplier(2)
                .maxDelayMs(150)
                .build());

        assertEquals(5, delays.size());
        long maxDelay = delays.stream().mapToLong(Long::longValue).max().orElseThrow();
        assertTrue(maxDelay < 200, "max observed delay " + maxDelay);
    }

    @Test
    void initialDelayAboveCapIsCapped() {
        List<Long> delays = recordDelays(RetryConfig.builder()
                .maxRetries(1)
                .initialDelayMs(5_000)
                .maxDelayMs(50)
                .build());

        assertEquals(1, delays.size());
        assertTrue(delays.get(0) < 1_000, "observed delay " + delays.get(0));
    }

    @Test
    void profileUpdatedBeforeProfileCreatedSucceedsOnceProfileArrives() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        boolean[] profileCreated = {false};

        String result = RetryUtils.executeWithRetry(() -> {
            if (attempts.incrementAndGet() == 2) {
                profileCreated[0] = true;
            }
            if (!profileCreated[0]) {
                throw new DependencyNotFoundException("Profile not found yet");
            }
            return "Profile updated successfully";
        }, RetryUtils::isDependencyNotFound, FAST);

        assertEquals("Profile updated successfully", result);
        assertEquals(2, attempts.get());
    }

    @Test
    void contentWaitsForTiersArrivingOneByOne() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        Set<String> availableTiers = new HashSet<>();

        String result = RetryUtils.executeWithRetry(() -> {
            int attempt = attempts.incrementAndGet();
            if (attempt == 2) {
                availableTiers.add("tier1");
            }
            if (attempt == 3) {
                availableTiers.add("tier2");
            }
            List<String> missing = List.of("tier1", "tier2").stream()
                    .filter(t -> !availableTiers.contains(t))
                    .collect(Collectors.toList());
            if (!missing.isEmpty()) {
                throw new DependencyNotFoundException("Missing tiers: " + String.join(", ", missing));
            }
            return "Content created successfully";
        }, RetryUtils::isDependencyNotFound, FAST);

        assertEquals("Content created successfully", result);
        assertEquals(3, attempts.get());
    }

    @Test
    void interruptDuringBackoffStopsRetryingAndKeepsFlag() {
        AtomicInteger attempts = new AtomicInteger();
        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedException.class, () ->
                    RetryUtils.executeWithRetry(() -> {
                        attempts.incrementAndGet();
                        throw new DependencyNotFoundException("Not ready yet");
                    }, RetryUtils::isDependencyNotFound, FAST));

            assertEquals(1, attempts.get());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    private static List<Long> recordDelays(RetryConfig config) {
        List<Long> delays = new ArrayList<>();
        long[] last = {0};
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(DependencyNotFoundException.class, () ->
                RetryUtils.executeWithRetry(() -> {
                    long now = System.nanoTime();
                    if (attempts.getAndIncrement() > 0) {
                        delays.add(TimeUnit.NANOSECONDS.toMillis(now - last[0]));
                    }
                    last[0] = now;
                    throw new DependencyNotFoundException("Always fails");
                }, RetryUtils::isDependencyNotFound, config));
        return delays;
    }
}
