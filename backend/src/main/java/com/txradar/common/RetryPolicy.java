package com.txradar.common;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff and jitter for external HTTP lookups.
 * maxAttempts counts the first call, so 1 means no retry.
 */
public final class RetryPolicy {

    private static final int MAX_SHIFT = 16;

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.jitterFactor = Math.min(1d, Math.max(0d, jitterFactor));
        this.maxAttempts = maxAttempts;
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(0L, 0d, 1);
    }

    /** Delay before retry number {@code retry} (1-based): base * 2^(retry-1), then jittered. */
    public long backoffMs(int retry) {
        long exponential = baseDelayMs << Math.min(Math.max(retry - 1, 0), MAX_SHIFT);
        if (jitterFactor == 0d) {
            return exponential;
        }
        double factor = 1d + (ThreadLocalRandom.current().nextDouble() * 2d - 1d) * jitterFactor;
        return Math.max(0L, Math.round(exponential * factor));
    }

    /**
     * Runs the call until it succeeds, throws a non-retryable exception or attempts run out; the last
     * exception is rethrown.
     */
    public <T> T execute(Supplier<T> call, Predicate<RuntimeException> retryable) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                last = e;
                if (attempt == maxAttempts || !retryable.test(e)) {
                    throw e;
                }
                sleep(backoffMs(attempt));
            }
        }
        throw last;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry backoff interrupted", e);
        }
    }
}
