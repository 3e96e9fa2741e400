package com.sessiongate.shared.model;

import java.time.Instant;

/**
 * One delivery of one event to one webhook. Instances are immutable; every attempt
 * produces a new task value.
 */
public record WebhookDeliveryTask(
    ProtocolEvent event,
    String url,
    String secret,
    int attempts,
    Instant nextAttemptAt,
    DeliveryStatus status,
    int lastStatusCode
) {
    public static WebhookDeliveryTask pending(ProtocolEvent event, WebhookConfig config, Instant now) {
        return new WebhookDeliveryTask(event, config.url(), config.secret(), 0, now, DeliveryStatus.PENDING, 0);
    }

    public String taskId() {
        return event.deliveryKey() + "@" + url;
    }

    public WebhookDeliveryTask attempted(int statusCode, Instant nextAttemptAt) {
        return new WebhookDeliveryTask(event, url, secret, attempts + 1, nextAttemptAt, DeliveryStatus.PENDING, statusCode);
    }

    public WebhookDeliveryTask withStatus(DeliveryStatus newStatus) {
        return new WebhookDeliveryTask(event, url, secret, attempts, nextAttemptAt, newStatus, lastStatusCode);
    }

    @Override
    public String toString() {
        return "WebhookDeliveryTask[" + taskId() + ", attempts=" + attempts + ", status=" + status
                + ", lastStatusCode=" + lastStatusCode + "]";
    }
}
