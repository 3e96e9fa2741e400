package com.sessiongate.shared.model;

import java.time.Instant;

public record OutboundRequest(
    String sessionId,
    String target,
    String content,
    String idempotencyKey,
    Instant enqueuedAt,
    int attempts
) {
    public OutboundRequest withAttempt() {
        return new OutboundRequest(sessionId, target, content, idempotencyKey, enqueuedAt, attempts + 1);
    }
}
