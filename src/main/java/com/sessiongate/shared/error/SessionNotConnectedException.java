package com.sessiongate.shared.error;

public class SessionNotConnectedException extends GatewayException {
    public SessionNotConnectedException(String sessionId) {
        super(ErrorCode.SESSION_NOT_CONNECTED, sessionId, "Session not connected: " + sessionId);
    }
}
