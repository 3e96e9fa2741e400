package com.sessiongate.sessions;

import com.sessiongate.shared.model.Credential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-session credential cache in front of the {@link PersistenceSink}. Writes for one
 * session are serialized; a write carrying an older version than the stored one is ignored.
 */
public class CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

    private final PersistenceSink sink;
    private final ConcurrentHashMap<String, Credential> latest = new ConcurrentHashMap<>();

    public CredentialStore(PersistenceSink sink) {
        this.sink = sink;
    }

    public Optional<Credential> load(String sessionId) {
        var cached = latest.get(sessionId);
        if (cached != null) return Optional.of(cached);
        var stored = sink.loadCredential(sessionId);
        stored.ifPresent(c -> latest.putIfAbsent(sessionId, c));
        return stored.map(c -> latest.getOrDefault(sessionId, c));
    }

    /**
     * Stores a credential blob.
     *
     * @return false if a newer version was already cached or stored
     */
    public boolean save(String sessionId, String blob, long version) {
        var accepted = new boolean[1];
        latest.compute(sessionId, (id, current) -> {
            if (current != null && current.version() > version) {
                return current;
            }
            var next = new Credential(id, blob, version, Instant.now());
            if (!sink.persistCredential(id, next)) {
                // the database holds a newer version; drop the cache so the next load reads it
                return null;
            }
            accepted[0] = true;
            return next;
        });
        if (!accepted[0]) {
            log.debug("Ignored stale credential version {} for session {}", version, sessionId);
        }
        return accepted[0];
    }

    public void invalidate(String sessionId) {
        latest.compute(sessionId, (id, current) -> {
            sink.deleteCredential(id);
            return null;
        });
        log.info("Credentials discarded for session {}", sessionId);
    }
}
