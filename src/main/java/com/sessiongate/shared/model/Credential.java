package com.sessiongate.shared.model;

import java.time.Instant;

/**
 * Opaque authentication material of a session. {@code version} is the sequence number of
 * the credentials-update event announcing it; the pairing result is announced the same way.
 */
public record Credential(
    String sessionId,
    String blob,
    long version,
    Instant rotatedAt
) {
    @Override
    public String toString() {
        return "Credential[sessionId=" + sessionId + ", version=" + version + ", rotatedAt=" + rotatedAt + "]";
    }
}
