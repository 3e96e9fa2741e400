package com.sessiongate.protocol;

import java.util.concurrent.CompletableFuture;

/**
 * A live link to the messaging network. Owned by exactly one supervisor thread.
 */
public interface ProtocolConnection extends AutoCloseable {

    /**
     * Sends one message. The future completes with the remote message id once the
     * network acknowledges it, or exceptionally if the send fails.
     */
    CompletableFuture<String> send(String target, String content);

    /** Asks the remote side to forget this device. */
    void logout();

    @Override
    void close();
}
