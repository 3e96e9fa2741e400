package com.sessiongate.gateway;

import com.sessiongate.dispatch.EventDispatcher;
import com.sessiongate.registry.SessionRegistry;
import com.sessiongate.shared.config.GatewayConfig;
import com.sessiongate.webhook.WebhookDeliveryWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;

/**
 * Resumes journaled webhook deliveries on startup. On shutdown, drains every live session
 * and then waits for the dispatcher lanes to empty, before the dispatcher and webhook pool
 * are closed.
 */
public class GatewayLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GatewayLifecycle.class);

    private final SessionRegistry registry;
    private final EventDispatcher dispatcher;
    private final WebhookDeliveryWorker webhookDeliveryWorker;
    private final Duration drainTimeout;
    private volatile boolean running;

    public GatewayLifecycle(SessionRegistry registry, EventDispatcher dispatcher,
                            WebhookDeliveryWorker webhookDeliveryWorker, GatewayConfig config) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.webhookDeliveryWorker = webhookDeliveryWorker;
        this.drainTimeout = Duration.ofMillis(config.supervisor().stopGraceMs() * 2);
    }

    @Override
    public void start() {
        try {
            webhookDeliveryWorker.resume();
        } catch (RuntimeException e) {
            log.error("Could not resume journaled webhook deliveries", e);
        }
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        try {
            var report = registry.drain(drainTimeout);
            log.info("Shutdown drain complete: {} stopped, {} forced", report.stopped(), report.forced());
            if (!dispatcher.awaitIdle(drainTimeout)) {
                log.warn("Event lanes still busy after {}ms; the dispatcher finishes them on close",
                        drainTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Shutdown drain interrupted");
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
