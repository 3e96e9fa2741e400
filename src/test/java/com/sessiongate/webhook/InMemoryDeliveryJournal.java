package com.sessiongate.webhook;

import com.sessiongate.shared.model.DeliveryStatus;
import com.sessiongate.shared.model.WebhookDeliveryTask;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class InMemoryDeliveryJournal implements DeliveryJournal {

    final Map<String, WebhookDeliveryTask> rows = new LinkedHashMap<>();

    @Override
    public synchronized void record(WebhookDeliveryTask task) {
        rows.put(task.taskId(), task);
    }

    @Override
    public synchronized List<WebhookDeliveryTask> pending() {
        return rows.values().stream()
                .filter(t -> t.status() == DeliveryStatus.PENDING)
                .map(t -> new WebhookDeliveryTask(t.event(), t.url(), null, t.attempts(), t.nextAttemptAt(),
                        t.status(), t.lastStatusCode()))
                .toList();
    }

    @Override
    public synchronized long lastSequence(String sessionId) {
        return rows.values().stream()
                .filter(t -> t.event().sessionId().equals(sessionId))
                .mapToLong(t -> t.event().sequence())
                .max().orElse(0L);
    }

    synchronized WebhookDeliveryTask row(String taskId) {
        return rows.get(taskId);
    }
}
