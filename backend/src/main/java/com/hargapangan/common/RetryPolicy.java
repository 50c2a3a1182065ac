package com.hargapangan.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with optional jitter for upstream retries.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds before the retry that follows the given zero-based failed attempt.
     * Formula: baseDelay * 2^attempt, then ±jitterFactor.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(exponential);
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return Math.max(0, value);
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    /** Total attempts including the first call. */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Price information default: 3 attempts, waits of 2s then 4s, no jitter.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(2000L, 0.0, 3);
    }
}
