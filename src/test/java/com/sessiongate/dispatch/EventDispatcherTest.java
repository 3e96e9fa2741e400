package com.sessiongate.dispatch;

import com.sessiongate.observability.GatewayMetrics;
import com.sessiongate.shared.config.DispatchConfig;
import com.sessiongate.shared.model.EventKind;
import com.sessiongate.shared.model.ProtocolEvent;
import com.sessiongate.support.Await;
import com.sessiongate.support.RecordingObservabilitySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class EventDispatcherTest {

    private final RecordingObservabilitySink observability = new RecordingObservabilitySink();
    private final GatewayMetrics metrics = new GatewayMetrics();
    private EventDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) dispatcher.close();
    }

    private EventDispatcher create(int capacity) {
        dispatcher = new EventDispatcher(new DispatchConfig(capacity, 3), metrics, observability, id -> 0L);
        return dispatcher;
    }

    private static long[] sequences(List<ProtocolEvent> events) {
        return events.stream().mapToLong(ProtocolEvent::sequence).toArray();
    }

    @Test
    void everyConsumerSeesContiguousSequencePerSession() throws InterruptedException {
        var d = create(1_000);
        var first = new CopyOnWriteArrayList<ProtocolEvent>();
        var second = new CopyOnWriteArrayList<ProtocolEvent>();
        d.register(EventConsumer.of("first", first::add));
        d.register(EventConsumer.of("second", second::add));

        for (int i = 0; i < 200; i++) {
            d.dispatch("a", EventKind.MESSAGE, Map.of("i", i));
            d.dispatch("b", EventKind.PRESENCE, Map.of("i", i));
        }
        assertTrue(d.awaitIdle(Duration.ofSeconds(5)));

        var expected = LongStream.rangeClosed(1, 200).toArray();
        for (var seen : List.of(first, second)) {
            assertArrayEquals(expected, sequences(seen.stream().filter(e -> e.sessionId().equals("a")).toList()));
            assertArrayEquals(expected, sequences(seen.stream().filter(e -> e.sessionId().equals("b")).toList()));
        }
        assertEquals(200, d.lastSequence("a"));
        assertEquals(400.0, metrics.eventsDispatched().count());
    }

    @Test
    void sequenceContinuesFromSeed() {
        dispatcher = new EventDispatcher(new DispatchConfig(10, 1), metrics, observability, id -> 41L);
        dispatcher.openSession("a");
        assertEquals(41, dispatcher.lastSequence("a"));
        assertEquals(42, dispatcher.dispatch("a", EventKind.MESSAGE, Map.of()).sequence());
    }

    @Test
    void slowConsumerDropsOldestWithoutBlockingOthers() throws InterruptedException {
        var d = create(5);
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var slow = new CopyOnWriteArrayList<ProtocolEvent>();
        var fast = new CopyOnWriteArrayList<ProtocolEvent>();
        d.register(EventConsumer.of("slow", e -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            slow.add(e);
        }));
        d.register(EventConsumer.of("fast", fast::add));

        d.dispatch("a", EventKind.MESSAGE, Map.of("i", 0));
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        long started = System.nanoTime();
        for (int i = 1; i < 50; i++) {
            d.dispatch("a", EventKind.MESSAGE, Map.of("i", i));
        }
        assertTrue(System.nanoTime() - started < TimeUnit.SECONDS.toNanos(1), "dispatch must not wait");
        Await.until(() -> !fast.isEmpty() && fast.get(fast.size() - 1).sequence() == 50, "fast consumer");

        release.countDown();
        assertTrue(d.awaitIdle(Duration.ofSeconds(5)));

        // one event was in the consumer when the lane filled up, the last five were kept
        assertEquals(50 - 1 - 5, d.droppedEvents("a", "slow"));
        assertEquals(44.0, metrics.droppedEvents("slow").count());
        assertEquals(6, slow.size());
        assertEquals(1, slow.get(0).sequence());
        assertArrayEquals(new long[] {1, 46, 47, 48, 49, 50}, sequences(slow));
        assertEquals(44, observability.dropped.stream()
                .filter(drop -> drop.consumer().equals("slow"))
                .mapToLong(RecordingObservabilitySink.Dropped::totalDropped)
                .max().orElse(0));
    }

    @Test
    void failingConsumerDoesNotAffectOthers() throws InterruptedException {
        var d = create(100);
        var healthy = new CopyOnWriteArrayList<ProtocolEvent>();
        d.register(EventConsumer.of("broken", e -> {
            throw new IllegalStateException("boom");
        }));
        d.register(EventConsumer.of("healthy", healthy::add));

        for (int i = 0; i < 10; i++) {
            d.dispatch("a", EventKind.MESSAGE, Map.of());
        }

        assertTrue(d.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(10, healthy.size());
        assertEquals(0, d.droppedEvents());
    }

    @Test
    void duplicateConsumerNameRejected() {
        var d = create(10);
        d.register(EventConsumer.of("x", e -> { }));
        assertThrows(IllegalArgumentException.class, () -> d.register(EventConsumer.of("x", e -> { })));
    }

    @Test
    void closeDeliversEverythingStillQueued() {
        var d = create(1_000);
        var persisted = new CopyOnWriteArrayList<ProtocolEvent>();
        d.register(EventConsumer.of("persistence", e -> {
            try {
                Thread.sleep(1);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            persisted.add(e);
        }));

        for (int i = 0; i < 300; i++) {
            d.dispatch("a", EventKind.MESSAGE, Map.of("i", i));
        }
        d.close();

        assertArrayEquals(LongStream.rangeClosed(1, 300).toArray(), sequences(persisted));
    }

    @Test
    void dispatchAfterCloseStillReachesConsumers() {
        var d = create(1_000);
        var seen = new CopyOnWriteArrayList<ProtocolEvent>();
        d.register(EventConsumer.of("persistence", seen::add));
        d.close();

        for (int i = 0; i < 100; i++) {
            d.dispatch("a", EventKind.MESSAGE, Map.of("i", i));
        }

        assertArrayEquals(LongStream.rangeClosed(1, 100).toArray(), sequences(seen));
    }

    @Test
    void seedStartsAfterHighestSource() {
        var seed = EventDispatcher.highestOf(List.of(id -> 64L, id -> 150L, id -> 0L));
        dispatcher = new EventDispatcher(new DispatchConfig(10, 1), metrics, observability, seed);

        assertEquals(151, dispatcher.dispatch("a", EventKind.MESSAGE, Map.of()).sequence());
        assertEquals(0, EventDispatcher.highestOf(List.of()).applyAsLong("a"));
    }
}
