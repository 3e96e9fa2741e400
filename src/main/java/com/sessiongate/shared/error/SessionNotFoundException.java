package com.sessiongate.shared.error;

public class SessionNotFoundException extends GatewayException {
    public SessionNotFoundException(String sessionId) {
        super(ErrorCode.NOT_FOUND, sessionId, "Session not found: " + sessionId);
    }
}
