package com.sessiongate.outbound;

import java.util.function.LongSupplier;

/**
 * Classic token bucket. A non-positive rate disables limiting.
 */
public class TokenBucket {

    private final double ratePerSecond;
    private final int burst;
    private final LongSupplier nanoClock;
    private double tokens;
    private long lastRefill;

    public TokenBucket(double ratePerSecond, int burst) {
        this(ratePerSecond, burst, System::nanoTime);
    }

    TokenBucket(double ratePerSecond, int burst, LongSupplier nanoClock) {
        if (burst < 1) {
            throw new IllegalArgumentException("burst must be >= 1, got: " + burst);
        }
        this.ratePerSecond = ratePerSecond;
        this.burst = burst;
        this.nanoClock = nanoClock;
        this.tokens = burst;
        this.lastRefill = nanoClock.getAsLong();
    }

    public synchronized boolean tryAcquire() {
        if (ratePerSecond <= 0) return true;
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        double earned = (now - lastRefill) / 1_000_000_000.0 * ratePerSecond;
        tokens = Math.min(burst, tokens + earned);
        lastRefill = now;
    }
}
