package com.sessiongate.webhook;

import com.sessiongate.dispatch.EventConsumer;
import com.sessiongate.sessions.WebhookConfigProvider;
import com.sessiongate.shared.model.ProtocolEvent;
import com.sessiongate.shared.model.WebhookDeliveryTask;

import java.time.Instant;

/**
 * Turns dispatched events into delivery tasks for sessions whose webhook accepts the kind.
 */
public class WebhookEventConsumer implements EventConsumer {

    private final WebhookConfigProvider configProvider;
    private final WebhookDeliveryWorker worker;

    public WebhookEventConsumer(WebhookConfigProvider configProvider, WebhookDeliveryWorker worker) {
        this.configProvider = configProvider;
        this.worker = worker;
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public void accept(ProtocolEvent event) {
        configProvider.getWebhookConfig(event.sessionId())
                .filter(config -> config.accepts(event.kind()))
                .ifPresent(config -> worker.submit(WebhookDeliveryTask.pending(event, config, Instant.now())));
    }
}
