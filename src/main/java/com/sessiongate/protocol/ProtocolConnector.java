package com.sessiongate.protocol;

import com.sessiongate.shared.model.Credential;

public interface ProtocolConnector {

    String id();

    /**
     * Opens a connection for a session. With stored credentials the call returns once the
     * connection is open. Without credentials the connection starts in pairing mode and
     * reports challenges and the pairing outcome through the listener.
     *
     * @param credential stored credential, or {@code null} to pair
     * @throws ProtocolException if the connection cannot be opened
     */
    ProtocolConnection connect(String sessionId, Credential credential, ProtocolListener listener)
            throws ProtocolException;
}
