package com.sessiongate.sessions;

import com.sessiongate.shared.model.Credential;
import com.sessiongate.shared.model.ProtocolEvent;

import java.util.Optional;

/**
 * Durable storage for events and credentials. Safe to call concurrently across sessions.
 */
public interface PersistenceSink {
    void persistEvent(String sessionId, ProtocolEvent event);

    /** @return false if the stored credential has a newer version and was kept */
    boolean persistCredential(String sessionId, Credential credential);

    Optional<Credential> loadCredential(String sessionId);
    void deleteCredential(String sessionId);

    /** Highest stored event sequence for the session, 0 if none. */
    long lastSequence(String sessionId);
}
