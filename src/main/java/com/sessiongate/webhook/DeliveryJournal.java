package com.sessiongate.webhook;

import com.sessiongate.shared.model.WebhookDeliveryTask;

import java.util.List;

/**
 * Durable record of webhook tasks, so retries survive a restart.
 */
public interface DeliveryJournal {

    /** Inserts or updates the task's row, keyed by {@link WebhookDeliveryTask#taskId()}. */
    void record(WebhookDeliveryTask task);

    /**
     * Tasks not yet delivered or exhausted. Secrets are not journaled, so the returned
     * tasks carry a null secret.
     */
    List<WebhookDeliveryTask> pending();

    /** Highest event sequence journaled for the session, 0 if none. */
    long lastSequence(String sessionId);
}
