package com.sessiongate.shared.config;

public record SupervisorConfig(
    long pairingTimeoutMs,
    long heartbeatTimeoutMs,
    long stopGraceMs,
    int mailboxCapacity,
    long pollIntervalMs,
    ReconnectConfig reconnect
) {
    public record ReconnectConfig(long baseDelayMs, long maxDelayMs, int maxAttempts, double jitter) {
        public static ReconnectConfig defaults() {
            return new ReconnectConfig(1_000, 60_000, 10, 0.2);
        }
    }

    public static SupervisorConfig defaults() {
        return new SupervisorConfig(120_000, 30_000, 5_000, 1024, 20, ReconnectConfig.defaults());
    }
}
