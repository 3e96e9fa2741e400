package com.sessiongate.protocol;

/**
 * Receives callbacks from a {@link ProtocolConnection}. Called from protocol-owned threads.
 * A session's listener may block while its mailbox is full, so connectors must not deliver
 * callbacks of different sessions on one thread.
 */
@FunctionalInterface
public interface ProtocolListener {
    void onSignal(ProtocolSignal signal);
}
