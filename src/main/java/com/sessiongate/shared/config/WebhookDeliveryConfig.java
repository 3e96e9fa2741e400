package com.sessiongate.shared.config;

public record WebhookDeliveryConfig(
    int workers,
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    long timeoutMs
) {
    public static WebhookDeliveryConfig defaults() {
        return new WebhookDeliveryConfig(4, 5, 1_000, 300_000, 10_000);
    }
}
