package com.sessiongate.registry;

import com.sessiongate.dispatch.EventDispatcher;
import com.sessiongate.outbound.OutboundMessageQueue;
import com.sessiongate.sessions.CredentialStore;
import com.sessiongate.shared.error.AlreadyActiveException;
import com.sessiongate.shared.error.SessionNotFoundException;
import com.sessiongate.shared.model.SendReceipt;
import com.sessiongate.shared.model.SessionOptions;
import com.sessiongate.shared.model.SessionSnapshot;
import com.sessiongate.supervisor.ConnectionSupervisor;
import com.sessiongate.supervisor.SupervisorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Entry point of the control surface. Holds at most one live supervisor per session id;
 * a terminal supervisor stays registered for status queries until the id is started again.
 */
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    /** Outcome of {@link #drain}. */
    public record DrainReport(int stopped, int forced) {}

    private final Map<String, ConnectionSupervisor> supervisors = new ConcurrentHashMap<>();
    private final SupervisorContext ctx;
    private final OutboundMessageQueue outbound;
    private final EventDispatcher dispatcher;
    private final CredentialStore credentials;

    public SessionRegistry(SupervisorContext ctx, OutboundMessageQueue outbound) {
        this.ctx = ctx;
        this.outbound = outbound;
        this.dispatcher = ctx.dispatcher();
        this.credentials = ctx.credentials();
    }

    /**
     * Starts supervising a session. Concurrent calls for the same id produce exactly one
     * supervisor; the others fail.
     *
     * @return the session's status right after registration
     * @throws AlreadyActiveException if a non-terminal supervisor exists for the id
     */
    public SessionSnapshot startSession(String sessionId, SessionOptions options) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        var opts = options == null ? SessionOptions.defaults() : options;
        var created = new ConnectionSupervisor[1];
        supervisors.compute(sessionId, (id, existing) -> {
            if (existing != null && !existing.state().isTerminal()) {
                throw new AlreadyActiveException(id);
            }
            dispatcher.openSession(id);
            var queue = outbound.open(id, opts);
            created[0] = new ConnectionSupervisor(id, opts, ctx, queue);
            return created[0];
        });
        var snapshot = created[0].snapshot();
        created[0].start();
        log.info("Session {} started", sessionId);
        return snapshot;
    }

    /**
     * Stops a session, waiting up to the configured grace period before interrupting it.
     * Stopping an already stopped session is a no-op, except that {@code logout} still
     * discards any stored credentials.
     *
     * @throws SessionNotFoundException if the id was never started
     */
    public SessionSnapshot stopSession(String sessionId, boolean logout) throws InterruptedException {
        var supervisor = supervisors.get(sessionId);
        if (supervisor == null) {
            throw new SessionNotFoundException(sessionId);
        }
        if (supervisor.isFinished()) {
            if (logout) credentials.invalidate(sessionId);
            return supervisor.snapshot();
        }
        supervisor.requestStop(logout);
        var grace = Duration.ofMillis(ctx.config().stopGraceMs());
        if (!supervisor.awaitTermination(grace)) {
            log.warn("Session {} did not stop within {}ms, interrupting", sessionId, grace.toMillis());
            supervisor.interrupt();
            supervisor.awaitTermination(grace);
        }
        log.info("Session {} stopped (logout={})", sessionId, logout);
        return supervisor.snapshot();
    }

    /** @throws SessionNotFoundException if the id was never started */
    public SessionSnapshot getStatus(String sessionId) {
        return lookup(sessionId).snapshot();
    }

    /** A fresh snapshot of every known session; safe to call while sessions start and stop. */
    public Stream<SessionSnapshot> listSessions() {
        return new ArrayList<>(supervisors.values()).stream().map(ConnectionSupervisor::snapshot);
    }

    public long activeCount() {
        return supervisors.values().stream().filter(s -> !s.state().isTerminal()).count();
    }

    /** @throws SessionNotFoundException if the id was never started */
    public String pairingChallenge(String sessionId) {
        return lookup(sessionId).snapshot().pairingChallenge();
    }

    public CompletableFuture<SendReceipt> sendMessage(String sessionId, String target, String content,
                                                      String idempotencyKey) {
        lookup(sessionId);
        return outbound.enqueue(sessionId, target, content, idempotencyKey);
    }

    /**
     * Stops every live session in parallel. Used on shutdown; credentials are kept so the
     * sessions can resume on the next start.
     */
    public DrainReport drain(Duration timeout) throws InterruptedException {
        var live = supervisors.values().stream().filter(s -> !s.isFinished()).toList();
        live.forEach(s -> s.requestStop(false));
        long deadline = System.nanoTime() + timeout.toNanos();
        int forced = 0;
        for (var supervisor : live) {
            long remaining = Math.max(0, deadline - System.nanoTime());
            if (!supervisor.awaitTermination(Duration.ofNanos(remaining))) {
                supervisor.interrupt();
                forced++;
            }
        }
        log.info("Drained {} sessions ({} forced)", live.size(), forced);
        return new DrainReport(live.size() - forced, forced);
    }

    private ConnectionSupervisor lookup(String sessionId) {
        var supervisor = supervisors.get(sessionId);
        if (supervisor == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return supervisor;
    }
}
