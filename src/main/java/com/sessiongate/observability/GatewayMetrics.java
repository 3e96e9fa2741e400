package com.sessiongate.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class GatewayMetrics {

    private final MeterRegistry registry;

    public GatewayMetrics() {
        this(new SimpleMeterRegistry());
    }

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter droppedEvents(String consumer) {
        return Counter.builder("sessiongate.dispatch.dropped").tag("consumer", consumer).register(registry);
    }

    public Counter eventsDispatched() {
        return Counter.builder("sessiongate.events.dispatched").register(registry);
    }

    public Counter reconnectAttempts() {
        return Counter.builder("sessiongate.reconnect.attempts").register(registry);
    }

    public Counter outboundSent() {
        return Counter.builder("sessiongate.outbound.sent").register(registry);
    }

    public Counter outboundFailed() {
        return Counter.builder("sessiongate.outbound.failed").register(registry);
    }

    public Counter webhookDelivered() {
        return Counter.builder("sessiongate.webhook.delivered").register(registry);
    }

    public Counter webhookExhausted() {
        return Counter.builder("sessiongate.webhook.exhausted").register(registry);
    }

    public Timer webhookLatency() {
        return Timer.builder("sessiongate.webhook.latency").register(registry);
    }
}
