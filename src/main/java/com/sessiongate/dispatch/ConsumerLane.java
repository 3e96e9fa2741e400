package com.sessiongate.dispatch;

import com.sessiongate.observability.GatewayObservabilitySink;
import com.sessiongate.shared.model.ProtocolEvent;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Bounded buffer between one session and one consumer. At most one drain task runs per lane,
 * which keeps the consumer's view in sequence order. When full, the oldest event is dropped.
 */
final class ConsumerLane {

    private static final Logger log = LoggerFactory.getLogger(ConsumerLane.class);
    private static final int DRAIN_BATCH = 64;

    private final String sessionId;
    private final EventConsumer consumer;
    private final int capacity;
    private final Executor executor;
    private final Counter droppedCounter;
    private final GatewayObservabilitySink observability;

    private final ArrayDeque<ProtocolEvent> pending = new ArrayDeque<>();
    private boolean draining;
    private long dropped;

    ConsumerLane(String sessionId, EventConsumer consumer, int capacity, Executor executor,
                 Counter droppedCounter, GatewayObservabilitySink observability) {
        this.sessionId = sessionId;
        this.consumer = consumer;
        this.capacity = capacity;
        this.executor = executor;
        this.droppedCounter = droppedCounter;
        this.observability = observability;
    }

    void offer(ProtocolEvent event) {
        long droppedTotal = 0;
        boolean schedule;
        synchronized (this) {
            if (pending.size() >= capacity) {
                pending.pollFirst();
                droppedTotal = ++dropped;
            }
            pending.addLast(event);
            schedule = !draining;
            draining = true;
        }
        if (droppedTotal > 0) {
            droppedCounter.increment();
            observability.onEventsDropped(sessionId, consumer.name(), droppedTotal);
        }
        if (schedule) {
            submitDrain();
        }
    }

    private void submitDrain() {
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            // pool is shutting down: finish the lane on this thread instead of losing it
            log.debug("Dispatcher stopped; delivering {} remaining events for consumer '{}' of session {} inline",
                    pendingCount(), consumer.name(), sessionId);
            deliver(Integer.MAX_VALUE);
        }
    }

    private void drain() {
        if (deliver(DRAIN_BATCH)) {
            // yield the pool thread to other lanes, keep the drain flag
            submitDrain();
        }
    }

    /** Returns true if events remain after {@code limit} deliveries. */
    private boolean deliver(int limit) {
        for (int i = 0; i < limit; i++) {
            ProtocolEvent next;
            synchronized (this) {
                next = pending.pollFirst();
                if (next == null) {
                    draining = false;
                    return false;
                }
            }
            try {
                consumer.accept(next);
            } catch (Exception e) {
                log.error("Consumer '{}' failed on event {}", consumer.name(), next.deliveryKey(), e);
            }
        }
        return true;
    }

    synchronized int pendingCount() {
        return pending.size();
    }

    synchronized long dropped() {
        return dropped;
    }

    synchronized boolean idle() {
        return pending.isEmpty() && !draining;
    }
}
