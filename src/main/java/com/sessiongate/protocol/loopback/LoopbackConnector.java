package com.sessiongate.protocol.loopback;

import com.sessiongate.protocol.ProtocolConnection;
import com.sessiongate.protocol.ProtocolConnector;
import com.sessiongate.protocol.ProtocolListener;
import com.sessiongate.protocol.ProtocolSignal;
import com.sessiongate.shared.model.Credential;
import com.sessiongate.shared.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * In-process connector for running the gateway without a real network. Pairing uses
 * six-digit codes confirmed through {@link #confirmPairing}; sends are acknowledged at once
 * and echoed back as inbound messages.
 *
 * <p>Each connection delivers its callbacks on its own thread, in emission order, so a
 * listener that blocks only holds up its own session. Heartbeat ticks share one scheduler.
 */
public class LoopbackConnector implements ProtocolConnector, Closeable {

    private static final Logger log = LoggerFactory.getLogger(LoopbackConnector.class);

    private final PairingService pairingService;
    private final long heartbeatIntervalMs;
    private final ScheduledExecutorService heartbeats;
    private final Map<String, LoopbackConnection> pairing = new ConcurrentHashMap<>();
    private final Set<LoopbackConnection> live = ConcurrentHashMap.newKeySet();

    public LoopbackConnector(PairingService pairingService, long heartbeatIntervalMs) {
        this.pairingService = pairingService;
        this.heartbeatIntervalMs = heartbeatIntervalMs;
        this.heartbeats = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("loopback-heartbeat-"));
    }

    @Override
    public String id() {
        return "loopback";
    }

    @Override
    public ProtocolConnection connect(String sessionId, Credential credential, ProtocolListener listener) {
        var connection = new LoopbackConnection(sessionId, listener);
        live.add(connection);
        if (credential == null) {
            pairing.put(sessionId, connection);
            var code = pairingService.generateCode(sessionId);
            log.info("Loopback pairing code issued for session {}", sessionId);
            connection.emit(ProtocolSignal.pairingChallenge(code));
        } else {
            connection.startHeartbeat();
        }
        return connection;
    }

    /** Simulates the phone accepting a pairing code. */
    public boolean confirmPairing(String sessionId, String code) {
        if (!pairingService.consumeCode(code, sessionId)) {
            return false;
        }
        var connection = pairing.remove(sessionId);
        if (connection == null) {
            return false;
        }
        connection.startHeartbeat();
        connection.emit(ProtocolSignal.paired("loopback:" + UUID.randomUUID()));
        return true;
    }

    @Override
    public void close() {
        heartbeats.shutdownNow();
        live.forEach(LoopbackConnection::close);
    }

    private final class LoopbackConnection implements ProtocolConnection {

        private final String sessionId;
        private final ProtocolListener listener;
        private final ExecutorService callbacks;
        private volatile boolean open = true;
        private ScheduledFuture<?> heartbeat;

        LoopbackConnection(String sessionId, ProtocolListener listener) {
            this.sessionId = sessionId;
            this.listener = listener;
            this.callbacks = Executors.newSingleThreadExecutor(new DaemonThreadFactory("loopback-" + sessionId + "-"));
        }

        synchronized void startHeartbeat() {
            if (heartbeat == null && open) {
                heartbeat = heartbeats.scheduleAtFixedRate(
                        () -> emit(ProtocolSignal.heartbeat()),
                        heartbeatIntervalMs, heartbeatIntervalMs, TimeUnit.MILLISECONDS);
            }
        }

        // callbacks never run on the caller's thread
        void emit(ProtocolSignal signal) {
            try {
                callbacks.execute(() -> {
                    if (open) listener.onSignal(signal);
                });
            } catch (RejectedExecutionException e) {
                log.debug("Loopback connection for session {} closed, dropped {}", sessionId, signal.type());
            }
        }

        @Override
        public CompletableFuture<String> send(String target, String content) {
            if (!open) {
                return CompletableFuture.failedFuture(new IllegalStateException("Connection closed"));
            }
            var messageId = UUID.randomUUID().toString();
            emit(ProtocolSignal.message(Map.of("from", target, "text", content, "echoOf", messageId)));
            return CompletableFuture.completedFuture(messageId);
        }

        @Override
        public void logout() {
            log.info("Loopback logout for session {}", sessionId);
        }

        @Override
        public synchronized void close() {
            open = false;
            if (heartbeat != null) heartbeat.cancel(false);
            pairing.remove(sessionId, this);
            pairingService.revoke(sessionId);
            callbacks.shutdown();
            live.remove(this);
        }
    }
}
