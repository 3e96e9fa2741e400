package com.sessiongate.dispatch;

import com.sessiongate.shared.model.ProtocolEvent;

/**
 * Fire-and-forget push to live observers of a session.
 */
@FunctionalInterface
public interface Broadcaster {
    void broadcast(String sessionId, ProtocolEvent event);
}
