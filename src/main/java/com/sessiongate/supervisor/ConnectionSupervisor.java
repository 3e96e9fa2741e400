package com.sessiongate.supervisor;

import com.sessiongate.outbound.SessionSendQueue;
import com.sessiongate.protocol.ProtocolConnection;
import com.sessiongate.protocol.ProtocolException;
import com.sessiongate.protocol.ProtocolSignal;
import com.sessiongate.shared.error.ErrorCode;
import com.sessiongate.shared.error.GatewayException;
import com.sessiongate.shared.model.Credential;
import com.sessiongate.shared.model.EventKind;
import com.sessiongate.shared.model.SessionOptions;
import com.sessiongate.shared.model.SessionSnapshot;
import com.sessiongate.shared.model.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives one session through pairing, connection, reconnection and shutdown on its own thread.
 *
 * <p>The protocol connection is touched only by the supervisor thread. Protocol callbacks are
 * queued in a bounded mailbox tagged with the connection generation, so signals from a
 * connection that has since been replaced are ignored. Outbound requests are taken from the
 * session's {@link SessionSendQueue} one at a time; the next is not sent until the previous
 * one was acknowledged, failed, or timed out.
 */
public class ConnectionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private enum Next { PAIR, SERVE, RECONNECT, DONE }

    private record Envelope(int generation, ProtocolSignal signal) {}

    private static final Envelope WAKE = new Envelope(-1, null);

    private final String sessionId;
    private final SessionOptions options;
    private final SupervisorContext ctx;
    private final SessionSendQueue sendQueue;
    private final BlockingQueue<Envelope> mailbox;
    private final AtomicBoolean wakePending = new AtomicBoolean();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);
    private final AtomicLong totalReconnectAttempts = new AtomicLong();

    private volatile SessionState state = SessionState.INITIALIZING;
    private volatile Instant lastSeen = Instant.now();
    private volatile int reconnectAttempts;
    private volatile ErrorCode lastError;
    private volatile String pairingChallenge;
    private volatile boolean stopRequested;
    private volatile boolean logoutOnStop;
    private volatile int generation;
    private Thread thread;

    // confined to the supervisor thread
    private ProtocolConnection connection;
    private long lastSeenNanos = System.nanoTime();
    private SessionSendQueue.PendingSend inFlight;
    private CompletableFuture<String> inFlightAck;
    private long inFlightDeadline;

    public ConnectionSupervisor(String sessionId, SessionOptions options, SupervisorContext ctx,
                                SessionSendQueue sendQueue) {
        this.sessionId = sessionId;
        this.options = options;
        this.ctx = ctx;
        this.sendQueue = sendQueue;
        this.mailbox = new ArrayBlockingQueue<>(ctx.config().mailboxCapacity());
        sendQueue.onEnqueue(this::wake);
    }

    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("Supervisor already started: " + sessionId);
        }
        thread = new Thread(this::run, "supervisor-" + sessionId);
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Asks the supervisor to disconnect. Pairing waits, backoff delays and pending
     * acknowledgments notice the request within one poll interval.
     */
    public void requestStop(boolean logout) {
        if (logout) logoutOnStop = true;
        stopRequested = true;
        stopSignal.countDown();
        wake();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Last resort after the grace period: interrupts whatever the supervisor is blocked on. */
    public synchronized void interrupt() {
        if (thread != null) thread.interrupt();
    }

    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    public String sessionId() {
        return sessionId;
    }

    public SessionOptions options() {
        return options;
    }

    public SessionState state() {
        return state;
    }

    public SessionSnapshot snapshot() {
        return new SessionSnapshot(sessionId, state, lastSeen, reconnectAttempts,
                totalReconnectAttempts.get(), lastError, pairingChallenge, sendQueue.size());
    }

    private void run() {
        try {
            var stored = ctx.credentials().load(sessionId);
            var next = stored.isPresent() ? connectWithStored(stored.get()) : Next.PAIR;
            while (next != Next.DONE) {
                switch (next) {
                    case PAIR:
                        next = pair();
                        break;
                    case SERVE:
                        next = serve();
                        break;
                    case RECONNECT:
                        next = reconnect();
                        break;
                    default:
                        next = Next.DONE;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Supervisor for session {} interrupted, forcing termination", sessionId);
            forceTerminate(null);
        } catch (RuntimeException e) {
            ctx.observability().onError(sessionId, ErrorCode.INTERNAL_ERROR, "Supervisor failed", e);
            forceTerminate(ErrorCode.INTERNAL_ERROR);
        } finally {
            closeConnection();
            sendQueue.close();
            finished.countDown();
        }
    }

    private Next connectWithStored(Credential credential) throws InterruptedException {
        if (stopRequested) return stopNow();
        try {
            open(credential);
            transition(SessionState.CONNECTED, null);
            return Next.SERVE;
        } catch (ProtocolException e) {
            if (e.loggedOut()) {
                ctx.observability().onError(sessionId, ErrorCode.LOGGED_OUT_BY_REMOTE,
                        "Stored credentials rejected, pairing again", e);
                ctx.credentials().invalidate(sessionId);
                return Next.PAIR;
            }
            ctx.observability().onError(sessionId, ErrorCode.TRANSPORT_DISCONNECTED,
                    "Initial connect failed: " + e.getMessage(), e);
            transition(SessionState.RECONNECTING, ErrorCode.TRANSPORT_DISCONNECTED);
            return Next.RECONNECT;
        }
    }

    private Next pair() throws InterruptedException {
        transition(SessionState.PAIRING, null);
        try {
            open(null);
        } catch (ProtocolException e) {
            ctx.observability().onError(sessionId, ErrorCode.PAIRING_REJECTED,
                    "Pairing could not start: " + e.getMessage(), e);
            return terminate(ErrorCode.PAIRING_REJECTED);
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(ctx.config().pairingTimeoutMs());
        while (true) {
            if (stopRequested) return stopNow();
            if (System.nanoTime() - deadline >= 0) {
                return terminate(ErrorCode.PAIRING_TIMEOUT);
            }
            var signal = pollSignal();
            if (signal == null) continue;
            switch (signal.type()) {
                case PAIRING_CHALLENGE:
                    var challenge = String.valueOf(signal.payload().get("challenge"));
                    pairingChallenge = challenge;
                    ctx.dispatcher().dispatch(sessionId, EventKind.PAIRING_UPDATE, Map.of("challenge", challenge));
                    break;
                case PAIRED:
                    storeCredential(signal.blob());
                    pairingChallenge = null;
                    transition(SessionState.CONNECTED, null);
                    return Next.SERVE;
                case PAIRING_REJECTED:
                case DISCONNECTED:
                case LOGGED_OUT:
                    ctx.observability().onError(sessionId, ErrorCode.PAIRING_REJECTED,
                            "Pairing ended: " + signal.reason(), null);
                    return terminate(ErrorCode.PAIRING_REJECTED);
                default:
                    log.debug("Session {} ignoring {} while pairing", sessionId, signal.type());
            }
        }
    }

    private Next serve() throws InterruptedException {
        reconnectAttempts = 0;
        sendQueue.markConnected(true);
        try {
            while (true) {
                if (stopRequested) return stopNow();
                var signal = pollSignal();
                if (signal != null) {
                    var next = handleLive(signal);
                    if (next != null) return next;
                }
                if (heartbeatExpired()) {
                    ctx.observability().onError(sessionId, ErrorCode.HEARTBEAT_TIMEOUT,
                            "No traffic for " + ctx.config().heartbeatTimeoutMs() + "ms", null);
                    closeConnection();
                    transition(SessionState.RECONNECTING, ErrorCode.HEARTBEAT_TIMEOUT);
                    return Next.RECONNECT;
                }
                pumpOutbound();
            }
        } finally {
            sendQueue.markConnected(false);
        }
    }

    private Next handleLive(ProtocolSignal signal) {
        switch (signal.type()) {
            case MESSAGE:
                ctx.dispatcher().dispatch(sessionId, EventKind.MESSAGE, signal.payload());
                return null;
            case PRESENCE:
                ctx.dispatcher().dispatch(sessionId, EventKind.PRESENCE, signal.payload());
                return null;
            case CREDENTIALS_UPDATE:
                storeCredential(signal.blob());
                return null;
            case DISCONNECTED:
                log.warn("Session {} transport dropped: {}", sessionId, signal.reason());
                closeConnection();
                transition(SessionState.RECONNECTING, ErrorCode.TRANSPORT_DISCONNECTED);
                return Next.RECONNECT;
            case LOGGED_OUT:
                closeConnection();
                ctx.credentials().invalidate(sessionId);
                transition(SessionState.LOGGED_OUT, ErrorCode.LOGGED_OUT_BY_REMOTE);
                sendQueue.close();
                return Next.DONE;
            default:
                return null;
        }
    }

    private Next reconnect() throws InterruptedException {
        var maxAttempts = ctx.config().reconnect().maxAttempts();
        while (true) {
            if (stopRequested) return stopNow();
            if (reconnectAttempts >= maxAttempts) {
                ctx.observability().onError(sessionId, ErrorCode.RECONNECT_ATTEMPTS_EXHAUSTED,
                        "Gave up after " + reconnectAttempts + " reconnect attempts", null);
                return terminate(ErrorCode.RECONNECT_ATTEMPTS_EXHAUSTED);
            }
            int attempt = ++reconnectAttempts;
            totalReconnectAttempts.incrementAndGet();
            ctx.metrics().reconnectAttempts().increment();
            long delay = ctx.backoff().computeDelayMs(attempt);
            log.info("Session {} reconnect attempt {}/{} in {}ms", sessionId, attempt, maxAttempts, delay);
            if (stopSignal.await(delay, TimeUnit.MILLISECONDS)) {
                return stopNow();
            }
            var credential = ctx.credentials().load(sessionId).orElse(null);
            if (credential == null) {
                ctx.observability().onError(sessionId, ErrorCode.TRANSPORT_DISCONNECTED,
                        "No stored credentials to reconnect with", null);
                return terminate(ErrorCode.TRANSPORT_DISCONNECTED);
            }
            try {
                open(credential);
                transition(SessionState.CONNECTED, null);
                return Next.SERVE;
            } catch (ProtocolException e) {
                if (e.loggedOut()) {
                    ctx.credentials().invalidate(sessionId);
                    transition(SessionState.LOGGED_OUT, ErrorCode.LOGGED_OUT_BY_REMOTE);
                    sendQueue.close();
                    return Next.DONE;
                }
                ctx.observability().onError(sessionId, ErrorCode.TRANSPORT_DISCONNECTED,
                        "Reconnect attempt " + attempt + " failed: " + e.getMessage(), e);
            }
        }
    }

    private void pumpOutbound() {
        if (inFlight == null) {
            var next = sendQueue.pollReady();
            if (next == null) return;
            inFlight = next;
            inFlightAck = sendOn(connection, next);
            inFlightAck.whenComplete((id, err) -> wake());
            inFlightDeadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(ctx.ackTimeoutMs());
        }
        if (inFlightAck.isDone()) {
            completeInFlight();
        } else if (System.nanoTime() - inFlightDeadline >= 0) {
            inFlightAck.cancel(false);
            failInFlight(ErrorCode.SEND_TIMEOUT, "No acknowledgment within " + ctx.ackTimeoutMs() + "ms", null);
        }
    }

    private static CompletableFuture<String> sendOn(ProtocolConnection connection, SessionSendQueue.PendingSend pending) {
        try {
            return connection.send(pending.request().target(), pending.request().content());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void completeInFlight() {
        try {
            var messageId = inFlightAck.join();
            sendQueue.acknowledge(inFlight, messageId);
            ctx.metrics().outboundSent().increment();
            inFlight = null;
            inFlightAck = null;
        } catch (CompletionException | CancellationException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            failInFlight(ErrorCode.SEND_FAILED, "Send failed: " + cause.getMessage(), cause);
        }
    }

    private void failInFlight(ErrorCode code, String message, Throwable cause) {
        var pending = inFlight;
        inFlight = null;
        inFlightAck = null;
        var failure = new GatewayException(code, sessionId, message, cause);
        if (!sendQueue.retryOrFail(pending, failure)) {
            ctx.metrics().outboundFailed().increment();
            ctx.observability().onError(sessionId, code,
                    message + " after " + pending.request().attempts() + " attempts", cause);
        }
    }

    /** Waits up to the grace period for the in-flight acknowledgment before tearing down. */
    private void flushInFlight() throws InterruptedException {
        if (inFlight == null) return;
        try {
            inFlightAck.get(ctx.config().stopGraceMs(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Session {} stopping with unacknowledged send", sessionId);
            return;
        } catch (CancellationException e) {
            return;
        }
        completeInFlight();
    }

    private Next stopNow() throws InterruptedException {
        flushInFlight();
        if (logoutOnStop && connection != null) {
            try {
                connection.logout();
            } catch (RuntimeException e) {
                log.warn("Session {} remote logout failed: {}", sessionId, e.getMessage());
            }
        }
        closeConnection();
        if (logoutOnStop) {
            ctx.credentials().invalidate(sessionId);
        }
        transition(SessionState.TERMINATED, null);
        sendQueue.close();
        return Next.DONE;
    }

    private Next terminate(ErrorCode reason) {
        closeConnection();
        transition(SessionState.TERMINATED, reason);
        sendQueue.close();
        return Next.DONE;
    }

    private void forceTerminate(ErrorCode reason) {
        closeConnection();
        if (logoutOnStop) {
            try {
                ctx.credentials().invalidate(sessionId);
            } catch (RuntimeException e) {
                log.error("Session {} could not discard credentials", sessionId, e);
            }
        }
        if (!state.isTerminal()) {
            transition(SessionState.TERMINATED, reason);
        }
    }

    private void storeCredential(String blob) {
        // the event sequence doubles as the credential version
        var event = ctx.dispatcher().dispatch(sessionId, EventKind.CREDENTIALS_UPDATE,
                Map.of("rotatedAt", Instant.now().toString()));
        ctx.credentials().save(sessionId, blob, event.sequence());
    }

    private void transition(SessionState to, ErrorCode reason) {
        var from = state;
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal transition " + from + " -> " + to + " for session " + sessionId);
        }
        state = to;
        if (reason != null) lastError = reason;
        ctx.observability().onStateTransition(sessionId, from, to, reason);
        if (to != SessionState.PAIRING) {
            var payload = new LinkedHashMap<String, Object>();
            payload.put("state", to.name());
            payload.put("previous", from.name());
            if (reason != null) payload.put("error", reason.name());
            ctx.dispatcher().dispatch(sessionId, EventKind.CONNECTION_UPDATE, payload);
        }
    }

    private void open(Credential credential) throws ProtocolException {
        int gen = ++generation;
        connection = ctx.connector().connect(sessionId, credential, signal -> enqueueSignal(gen, signal));
        markSeen();
    }

    private void closeConnection() {
        generation++;
        if (inFlight != null) {
            // unacknowledged: it goes out again, first, on the next connection
            inFlightAck.cancel(false);
            sendQueue.returnToHead(inFlight);
            inFlight = null;
            inFlightAck = null;
        }
        if (connection != null) {
            try {
                connection.close();
            } catch (RuntimeException e) {
                log.warn("Session {} connection close failed: {}", sessionId, e.getMessage());
            }
            connection = null;
        }
    }

    private void enqueueSignal(int gen, ProtocolSignal signal) {
        var envelope = new Envelope(gen, signal);
        if (signal.type() == ProtocolSignal.Type.HEARTBEAT) {
            mailbox.offer(envelope);
            return;
        }
        try {
            // back-pressure on the protocol thread while the supervisor catches up
            while (!mailbox.offer(envelope, ctx.config().pollIntervalMs(), TimeUnit.MILLISECONDS)) {
                if (isFinished() || gen != generation) {
                    log.warn("Session {} discarded {} for a closed connection", sessionId, signal.type());
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void wake() {
        if (wakePending.compareAndSet(false, true) && !mailbox.offer(WAKE)) {
            wakePending.set(false);
        }
    }

    private ProtocolSignal pollSignal() throws InterruptedException {
        var envelope = mailbox.poll(ctx.config().pollIntervalMs(), TimeUnit.MILLISECONDS);
        if (envelope == null) return null;
        if (envelope == WAKE) {
            wakePending.set(false);
            return null;
        }
        if (envelope.generation() != generation) {
            log.debug("Session {} dropped stale {}", sessionId, envelope.signal().type());
            return null;
        }
        markSeen();
        return envelope.signal();
    }

    private void markSeen() {
        lastSeenNanos = System.nanoTime();
        lastSeen = Instant.now();
    }

    private boolean heartbeatExpired() {
        return System.nanoTime() - lastSeenNanos > TimeUnit.MILLISECONDS.toNanos(ctx.config().heartbeatTimeoutMs());
    }
}
