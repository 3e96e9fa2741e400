package com.sessiongate.outbound;

import com.sessiongate.shared.config.OutboundConfig;
import com.sessiongate.shared.error.SessionNotFoundException;
import com.sessiongate.shared.model.SendReceipt;
import com.sessiongate.shared.model.SessionOptions;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds one {@link SessionSendQueue} per session. The queue for a session is replaced
 * whenever the session is started again.
 */
public class OutboundMessageQueue {

    private final OutboundConfig config;
    private final Map<String, SessionSendQueue> queues = new ConcurrentHashMap<>();

    public OutboundMessageQueue(OutboundConfig config) {
        this.config = config;
    }

    public SessionSendQueue open(String sessionId, SessionOptions options) {
        var queue = new SessionSendQueue(sessionId, options.allowBuffering(), config);
        var previous = queues.put(sessionId, queue);
        if (previous != null) previous.close();
        return queue;
    }

    /**
     * Appends a send request to the session's FIFO.
     *
     * @param idempotencyKey optional; a repeated key within the recent window returns the first receipt
     * @throws SessionNotFoundException if the session was never started
     * @throws com.sessiongate.shared.error.SessionNotConnectedException if the session is not
     *         connected and buffering is off, or the session has ended
     * @throws com.sessiongate.shared.error.QueueFullException if the buffer is at capacity
     */
    public CompletableFuture<SendReceipt> enqueue(String sessionId, String target, String content,
                                                  String idempotencyKey) {
        var queue = queues.get(sessionId);
        if (queue == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return queue.enqueue(target, content, idempotencyKey);
    }

    public Optional<SessionSendQueue> queue(String sessionId) {
        return Optional.ofNullable(queues.get(sessionId));
    }

    public int pending(String sessionId) {
        var queue = queues.get(sessionId);
        return queue == null ? 0 : queue.size();
    }
}
