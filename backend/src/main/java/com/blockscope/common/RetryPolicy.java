package com.blockscope.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Linear backoff with jitter, used when a freshly announced block is not served by the node yet.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.jitterFactor = Math.max(0, jitterFactor);
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds after the given one-based failed attempt.
     * Formula: baseDelay * attempt, then ±jitter.
     */
    public long delayMs(int attempt) {
        long linear = baseDelayMs * Math.max(1, attempt);
        return jitter(linear);
    }

    private long jitter(long value) {
        if (jitterFactor == 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default for block fetches: 200ms base, no jitter, 15 attempts.
     */
    public static RetryPolicy blockFetchPolicy() {
        return new RetryPolicy(200L, 0, 15);
    }
}
