package com.sessiongate.supervisor;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with one-sided jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1) * (1 + jitter * r)} with {@code r} in [0, 1),
 * capped at {@code maxDelay}. With {@code jitter <= 1} the delay never decreases from one
 * attempt to the next.
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitter;
    private final DoubleSupplier random;

    public ExponentialBackoffPolicy(long baseDelayMs, long maxDelayMs, double jitter) {
        this(baseDelayMs, maxDelayMs, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    ExponentialBackoffPolicy(long baseDelayMs, long maxDelayMs, double jitter, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        if (jitter < 0 || jitter > 1) {
            throw new IllegalArgumentException("jitter must be within [0, 1], got: " + jitter);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitter = jitter;
        this.random = random;
    }

    @Override
    public long computeDelayMs(int attempt) {
        if (attempt <= 0) {
            return 0L;
        }
        // once the doubling passes the cap there is nothing left to compute
        if (attempt >= 63 || (1L << (attempt - 1)) > maxDelayMs / baseDelayMs) {
            return maxDelayMs;
        }
        long expDelay = baseDelayMs << (attempt - 1);
        long withJitter = expDelay + (long) (expDelay * jitter * random.getAsDouble());
        return Math.min(maxDelayMs, withJitter);
    }
}
