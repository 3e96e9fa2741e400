package com.sessiongate.outbound;

import com.sessiongate.shared.config.OutboundConfig;
import com.sessiongate.shared.error.GatewayException;
import com.sessiongate.shared.error.QueueFullException;
import com.sessiongate.shared.error.SessionNotConnectedException;
import com.sessiongate.shared.model.OutboundRequest;
import com.sessiongate.shared.model.SendReceipt;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;

/**
 * FIFO of send requests for one session. Producers are control-surface callers; the single
 * consumer is the session's supervisor, which takes one request at a time.
 */
public class SessionSendQueue {

    /** A request together with the receipt its caller is waiting on. */
    public record PendingSend(OutboundRequest request, CompletableFuture<SendReceipt> receipt) {
        PendingSend withAttempt() {
            return new PendingSend(request.withAttempt(), receipt);
        }
    }

    private final String sessionId;
    private final boolean allowBuffering;
    private final int capacity;
    private final int maxSendAttempts;
    private final TokenBucket rateLimit;
    private final IdempotencyWindow idempotency;
    private final ArrayDeque<PendingSend> fifo = new ArrayDeque<>();
    private boolean connected;
    private boolean closed;
    private volatile Runnable onEnqueue = () -> { };

    public SessionSendQueue(String sessionId, boolean allowBuffering, OutboundConfig config) {
        this(sessionId, allowBuffering, config,
                new TokenBucket(config.rate().perSecond(), config.rate().burst()));
    }

    SessionSendQueue(String sessionId, boolean allowBuffering, OutboundConfig config, TokenBucket rateLimit) {
        this.sessionId = sessionId;
        this.allowBuffering = allowBuffering;
        this.capacity = config.bufferCapacity();
        this.maxSendAttempts = Math.max(1, config.maxSendAttempts());
        this.rateLimit = rateLimit;
        this.idempotency = new IdempotencyWindow(config.idempotencyWindow());
    }

    public synchronized CompletableFuture<SendReceipt> enqueue(String target, String content, String idempotencyKey) {
        if (closed) {
            throw new SessionNotConnectedException(sessionId);
        }
        if (idempotencyKey != null) {
            var existing = idempotency.find(idempotencyKey);
            if (existing != null) return existing;
        }
        if (!connected && !allowBuffering) {
            throw new SessionNotConnectedException(sessionId);
        }
        if (fifo.size() >= capacity) {
            throw new QueueFullException(sessionId, capacity);
        }
        var receipt = new CompletableFuture<SendReceipt>();
        var request = new OutboundRequest(sessionId, target, content, idempotencyKey, Instant.now(), 0);
        fifo.addLast(new PendingSend(request, receipt));
        if (idempotencyKey != null) {
            idempotency.remember(idempotencyKey, receipt);
        }
        onEnqueue.run();
        return receipt;
    }

    /**
     * Takes the head request if the session is connected and the rate limit allows it.
     * The returned request already counts the attempt about to be made.
     */
    public synchronized PendingSend pollReady() {
        if (!connected || fifo.isEmpty()) return null;
        if (!rateLimit.tryAcquire()) return null;
        return fifo.pollFirst().withAttempt();
    }

    /** Puts an unacknowledged request back at the head without charging an attempt. */
    public synchronized void returnToHead(PendingSend pending) {
        var request = pending.request();
        var uncounted = new OutboundRequest(request.sessionId(), request.target(), request.content(),
                request.idempotencyKey(), request.enqueuedAt(), request.attempts() - 1);
        fifo.addFirst(new PendingSend(uncounted, pending.receipt()));
    }

    /**
     * Records a failed attempt: the request goes back to the head while attempts remain.
     *
     * @return true if the request will be retried
     */
    public synchronized boolean retryOrFail(PendingSend pending, GatewayException failure) {
        if (pending.request().attempts() < maxSendAttempts && !closed) {
            fifo.addFirst(pending);
            return true;
        }
        pending.receipt().completeExceptionally(failure);
        return false;
    }

    public void acknowledge(PendingSend pending, String messageId) {
        var request = pending.request();
        pending.receipt().complete(new SendReceipt(
                sessionId, request.idempotencyKey(), messageId, request.attempts(), Instant.now()));
    }

    /** Hook run after each accepted request; must not block. */
    public void onEnqueue(Runnable callback) {
        this.onEnqueue = callback;
    }

    public synchronized void markConnected(boolean connected) {
        this.connected = connected;
    }

    /** Rejects further sends and fails everything still queued. */
    public void close() {
        var abandoned = new ArrayList<PendingSend>();
        synchronized (this) {
            closed = true;
            connected = false;
            abandoned.addAll(fifo);
            fifo.clear();
        }
        for (var pending : abandoned) {
            pending.receipt().completeExceptionally(new SessionNotConnectedException(sessionId));
        }
    }

    public synchronized boolean isConnected() {
        return connected;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int size() {
        return fifo.size();
    }

    public String sessionId() {
        return sessionId;
    }
}
