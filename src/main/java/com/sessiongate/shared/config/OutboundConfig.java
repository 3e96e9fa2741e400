package com.sessiongate.shared.config;

public record OutboundConfig(
    long ackTimeoutMs,
    int bufferCapacity,
    boolean allowBuffering,
    int maxSendAttempts,
    int idempotencyWindow,
    RateConfig rate
) {
    public record RateConfig(double perSecond, int burst) {
        public static RateConfig defaults() {
            return new RateConfig(5.0, 10);
        }
    }

    public static OutboundConfig defaults() {
        return new OutboundConfig(10_000, 500, false, 3, 1000, RateConfig.defaults());
    }
}
