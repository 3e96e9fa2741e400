package com.sessiongate.dispatch;

import com.sessiongate.observability.GatewayMetrics;
import com.sessiongate.observability.GatewayObservabilitySink;
import com.sessiongate.shared.config.DispatchConfig;
import com.sessiongate.shared.model.EventKind;
import com.sessiongate.shared.model.ProtocolEvent;
import com.sessiongate.shared.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.ToLongFunction;

/**
 * Numbers inbound events per session and fans them out to every registered consumer.
 *
 * <p>{@link #dispatch} never waits for a consumer: each (session, consumer) pair has its own
 * bounded {@link ConsumerLane} drained on a shared pool. A slow or failing consumer only
 * affects its own lanes.
 */
public class EventDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final List<EventConsumer> consumers = new CopyOnWriteArrayList<>();
    private final Map<String, SessionChannel> channels = new ConcurrentHashMap<>();
    private final ExecutorService executor;
    private final DispatchConfig config;
    private final GatewayMetrics metrics;
    private final GatewayObservabilitySink observability;
    private final ToLongFunction<String> sequenceSeed;

    /**
     * @param sequenceSeed last sequence already used by a session, read once when the session opens
     */
    public EventDispatcher(DispatchConfig config, GatewayMetrics metrics,
                           GatewayObservabilitySink observability, ToLongFunction<String> sequenceSeed) {
        if (config.consumerBufferCapacity() <= 0 || config.threads() <= 0) {
            throw new IllegalArgumentException("consumer buffer capacity and threads must be > 0");
        }
        this.config = config;
        this.metrics = metrics;
        this.observability = observability;
        this.sequenceSeed = sequenceSeed;
        this.executor = Executors.newFixedThreadPool(config.threads(), new DaemonThreadFactory("event-dispatch-"));
    }

    /**
     * Seed that starts a session after the highest sequence any source has seen. Event
     * persistence runs behind the lanes, so credential versions and journaled webhook
     * tasks can be ahead of the stored event log.
     */
    public static ToLongFunction<String> highestOf(List<ToLongFunction<String>> sources) {
        var copy = List.copyOf(sources);
        return sessionId -> copy.stream().mapToLong(f -> f.applyAsLong(sessionId)).max().orElse(0L);
    }

    public void register(EventConsumer consumer) {
        if (consumers.stream().anyMatch(c -> c.name().equals(consumer.name()))) {
            throw new IllegalArgumentException("Duplicate event consumer: " + consumer.name());
        }
        consumers.add(consumer);
    }

    public void openSession(String sessionId) {
        channels.computeIfAbsent(sessionId, id -> new SessionChannel(id, sequenceSeed.applyAsLong(id)));
    }

    /**
     * Assigns the next sequence number and hands the event to every consumer lane.
     */
    public ProtocolEvent dispatch(String sessionId, EventKind kind, Map<String, Object> payload) {
        var channel = channels.computeIfAbsent(sessionId, id -> new SessionChannel(id, sequenceSeed.applyAsLong(id)));
        ProtocolEvent event;
        synchronized (channel) {
            event = new ProtocolEvent(sessionId, ++channel.sequence, kind, payload, Instant.now());
            for (var consumer : consumers) {
                channel.lanes.computeIfAbsent(consumer.name(), name -> newLane(sessionId, consumer)).offer(event);
            }
        }
        metrics.eventsDispatched().increment();
        return event;
    }

    public long lastSequence(String sessionId) {
        var channel = channels.get(sessionId);
        if (channel == null) return 0;
        synchronized (channel) {
            return channel.sequence;
        }
    }

    public long droppedEvents() {
        return channels.values().stream()
                .flatMap(c -> c.lanes.values().stream())
                .mapToLong(ConsumerLane::dropped)
                .sum();
    }

    public long droppedEvents(String sessionId, String consumer) {
        var channel = channels.get(sessionId);
        if (channel == null) return 0;
        var lane = channel.lanes.get(consumer);
        return lane == null ? 0 : lane.dropped();
    }

    /** Waits until every lane has been drained. Returns false on timeout. */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!idle()) {
            if (System.nanoTime() >= deadline) return false;
            Thread.sleep(5);
        }
        return true;
    }

    private boolean idle() {
        return channels.values().stream()
                .flatMap(c -> c.lanes.values().stream())
                .allMatch(ConsumerLane::idle);
    }

    private ConsumerLane newLane(String sessionId, EventConsumer consumer) {
        return new ConsumerLane(sessionId, consumer, config.consumerBufferCapacity(), executor,
                metrics.droppedEvents(consumer.name()), observability);
    }

    /**
     * Delivers what the lanes still hold, then stops the pool. Lanes whose drain task is
     * rejected by the stopped pool finish on the calling thread, so no queued event is lost.
     */
    @Override
    public void close() {
        try {
            if (!awaitIdle(CLOSE_TIMEOUT)) {
                log.warn("Event lanes not idle after {}s, finishing them on shutdown", CLOSE_TIMEOUT.toSeconds());
            }
            executor.shutdown();
            if (!executor.awaitTermination(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                runAbandoned(executor.shutdownNow());
            }
        } catch (InterruptedException e) {
            runAbandoned(executor.shutdownNow());
            Thread.currentThread().interrupt();
        }
    }

    private void runAbandoned(List<Runnable> drains) {
        if (drains.isEmpty()) return;
        log.warn("Running {} queued drain tasks on the closing thread", drains.size());
        drains.forEach(Runnable::run);
    }

    private static final class SessionChannel {
        private final String sessionId;
        private final Map<String, ConsumerLane> lanes = new ConcurrentHashMap<>();
        private long sequence;

        SessionChannel(String sessionId, long startAfter) {
            this.sessionId = sessionId;
            this.sequence = startAfter;
        }

        @Override
        public String toString() {
            return "SessionChannel[" + sessionId + "]";
        }
    }
}
