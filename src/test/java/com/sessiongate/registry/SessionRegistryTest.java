package com.sessiongate.registry;

import com.sessiongate.dispatch.EventDispatcher;
import com.sessiongate.observability.GatewayMetrics;
import com.sessiongate.outbound.OutboundMessageQueue;
import com.sessiongate.protocol.ProtocolSignal;
import com.sessiongate.sessions.CredentialStore;
import com.sessiongate.shared.config.DispatchConfig;
import com.sessiongate.shared.config.OutboundConfig;
import com.sessiongate.shared.config.SupervisorConfig;
import com.sessiongate.shared.error.AlreadyActiveException;
import com.sessiongate.shared.error.SessionNotConnectedException;
import com.sessiongate.shared.error.SessionNotFoundException;
import com.sessiongate.shared.model.Credential;
import com.sessiongate.shared.model.SessionOptions;
import com.sessiongate.shared.model.SessionSnapshot;
import com.sessiongate.shared.model.SessionState;
import com.sessiongate.supervisor.ExponentialBackoffPolicy;
import com.sessiongate.supervisor.SupervisorContext;
import com.sessiongate.support.Await;
import com.sessiongate.support.FakeProtocolConnector;
import com.sessiongate.support.InMemoryPersistenceSink;
import com.sessiongate.support.RecordingObservabilitySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SessionRegistryTest {

    private final FakeProtocolConnector connector = new FakeProtocolConnector();
    private final InMemoryPersistenceSink sink = new InMemoryPersistenceSink();
    private EventDispatcher dispatcher;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        var observability = new RecordingObservabilitySink();
        var metrics = new GatewayMetrics();
        dispatcher = new EventDispatcher(new DispatchConfig(100, 2), metrics, observability, sink::lastSequence);
        var supervisorConfig = new SupervisorConfig(5_000, 10_000, 500, 64, 5,
                new SupervisorConfig.ReconnectConfig(10, 40, 3, 0.0));
        var outboundConfig = new OutboundConfig(1_000, 10, false, 3, 100, new OutboundConfig.RateConfig(0, 1));
        var ctx = new SupervisorContext(supervisorConfig, outboundConfig.ackTimeoutMs(), connector,
                new CredentialStore(sink), dispatcher, new ExponentialBackoffPolicy(10, 40, 0.0),
                observability, metrics);
        registry = new SessionRegistry(ctx, new OutboundMessageQueue(outboundConfig));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        registry.drain(Duration.ofSeconds(2));
        dispatcher.close();
    }

    private void storeCredential(String sessionId) {
        sink.credentials.put(sessionId, new Credential(sessionId, "blob", 1, Instant.now()));
    }

    @Test
    void startReturnsInitializingSnapshot() {
        var snapshot = registry.startSession("t1", SessionOptions.defaults());

        assertEquals("t1", snapshot.sessionId());
        assertEquals(SessionState.INITIALIZING, snapshot.state());
        assertNull(snapshot.lastError());
        Await.until(() -> registry.getStatus("t1").state() == SessionState.PAIRING, "pairing");
    }

    @Test
    void secondStartWithoutStopIsAlreadyActive() {
        registry.startSession("t1", SessionOptions.defaults());

        var ex = assertThrows(AlreadyActiveException.class,
                () -> registry.startSession("t1", SessionOptions.defaults()));
        assertEquals("t1", ex.sessionId());
    }

    @Test
    void concurrentStartsProduceOneSupervisor() throws InterruptedException {
        var pool = Executors.newFixedThreadPool(8);
        var go = new CountDownLatch(1);
        var started = new AtomicInteger();
        var rejected = new AtomicInteger();
        for (int i = 0; i < 8; i++) {
            pool.execute(() -> {
                try {
                    go.await();
                    registry.startSession("t1", SessionOptions.defaults());
                    started.incrementAndGet();
                } catch (AlreadyActiveException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        go.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(1, started.get());
        assertEquals(7, rejected.get());
        Await.until(() -> connector.connections.size() == 1, "single connection");
    }

    @Test
    void stopIsIdempotent() throws InterruptedException {
        storeCredential("t1");
        registry.startSession("t1", SessionOptions.defaults());
        Await.until(() -> registry.getStatus("t1").state() == SessionState.CONNECTED, "connected");

        var first = registry.stopSession("t1", false);
        var second = registry.stopSession("t1", false);

        assertEquals(SessionState.TERMINATED, first.state());
        assertEquals(SessionState.TERMINATED, second.state());
        assertTrue(sink.credentials.containsKey("t1"));
    }

    @Test
    void stopWithLogoutOnStoppedSessionStillDiscardsCredentials() throws InterruptedException {
        storeCredential("t1");
        registry.startSession("t1", SessionOptions.defaults());
        Await.until(() -> registry.getStatus("t1").state() == SessionState.CONNECTED, "connected");
        registry.stopSession("t1", false);

        registry.stopSession("t1", true);

        assertFalse(sink.credentials.containsKey("t1"));
    }

    @Test
    void restartAfterStopCreatesNewSupervisor() throws InterruptedException {
        storeCredential("t1");
        registry.startSession("t1", SessionOptions.defaults());
        Await.until(() -> registry.getStatus("t1").state() == SessionState.CONNECTED, "connected");
        registry.stopSession("t1", false);

        var restarted = registry.startSession("t1", SessionOptions.defaults());

        assertEquals(SessionState.INITIALIZING, restarted.state());
        Await.until(() -> registry.getStatus("t1").state() == SessionState.CONNECTED, "reconnected");
        assertEquals(2, connector.connections.size());
    }

    @Test
    void unknownSessionIsNotFound() {
        assertThrows(SessionNotFoundException.class, () -> registry.getStatus("ghost"));
        assertThrows(SessionNotFoundException.class, () -> registry.stopSession("ghost", false));
        assertThrows(SessionNotFoundException.class, () -> registry.sendMessage("ghost", "peer", "hi", null));
        assertThrows(SessionNotFoundException.class, () -> registry.pairingChallenge("ghost"));
    }

    @Test
    void listSessionsReflectsCurrentState() throws InterruptedException {
        storeCredential("a");
        registry.startSession("a", SessionOptions.defaults());
        registry.startSession("b", SessionOptions.defaults());
        Await.until(() -> registry.getStatus("a").state() == SessionState.CONNECTED, "a connected");

        var before = registry.listSessions().map(SessionSnapshot::sessionId).sorted().toList();
        assertEquals(List.of("a", "b"), before);
        assertEquals(2, registry.activeCount());

        registry.stopSession("a", false);
        var states = new ArrayList<SessionState>();
        registry.listSessions().filter(s -> s.sessionId().equals("a")).forEach(s -> states.add(s.state()));
        assertEquals(List.of(SessionState.TERMINATED), states);
        assertEquals(1, registry.activeCount());
    }

    @Test
    void sendRequiresConnectionUnlessBuffering() {
        registry.startSession("strict", SessionOptions.defaults());
        registry.startSession("lenient", new SessionOptions(true, Map.of()));

        assertThrows(SessionNotConnectedException.class, () -> registry.sendMessage("strict", "peer", "hi", null));
        var receipt = registry.sendMessage("lenient", "peer", "hi", "k1");
        assertFalse(receipt.isDone());
    }

    @Test
    void pairingChallengeIsExposed() {
        registry.startSession("t1", SessionOptions.defaults());
        Await.until(() -> registry.pairingChallenge("t1") != null, "challenge");
        assertEquals("challenge-1", registry.pairingChallenge("t1"));

        connector.connection(0).emit(ProtocolSignal.paired("blob"));
        Await.until(() -> registry.getStatus("t1").state() == SessionState.CONNECTED, "connected");
        assertNull(registry.pairingChallenge("t1"));
    }

    @Test
    void drainStopsEverySessionAndKeepsCredentials() throws InterruptedException {
        storeCredential("a");
        storeCredential("b");
        registry.startSession("a", SessionOptions.defaults());
        registry.startSession("b", SessionOptions.defaults());
        Await.until(() -> registry.activeCount() == 2
                && registry.listSessions().allMatch(s -> s.state() == SessionState.CONNECTED), "connected");

        var report = registry.drain(Duration.ofSeconds(2));

        assertEquals(2, report.stopped());
        assertEquals(0, report.forced());
        assertEquals(0, registry.activeCount());
        assertTrue(sink.credentials.containsKey("a"));
        assertTrue(sink.credentials.containsKey("b"));
    }
}
