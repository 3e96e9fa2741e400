package com.sessiongate.shared.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One inbound event of a session, numbered by the dispatcher.
 * The sequence is strictly increasing per session and starts at 1.
 */
public record ProtocolEvent(
    String sessionId,
    long sequence,
    EventKind kind,
    Map<String, Object> payload,
    Instant receivedAt
) {
    public ProtocolEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /** Dedup key handed to webhook receivers. */
    public String deliveryKey() {
        return sessionId + ":" + sequence;
    }
}
