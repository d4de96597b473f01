package com.feerouter.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter. Used by the crank keeper between rejected pages and by the
 * vesting adapter for read-only lookups. Never applied to fee claims.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.jitterFactor = Math.min(1.0, Math.max(0.0, jitterFactor));
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before the retry that follows the given zero-based attempt: baseDelay * 2^attempt, ± jitter.
     */
    public long delayMs(int attempt) {
        int shift = Math.min(Math.max(attempt, 0), 20);
        return jitter(baseDelayMs * (1L << shift));
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Sleeps for {@link #delayMs(int)}; restores the interrupt flag and returns false if interrupted.
     */
    public boolean pause(int attempt) {
        try {
            Thread.sleep(delayMs(attempt));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double factor = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * factor));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
