package com.sessiongate.shared.error;

public class AlreadyActiveException extends GatewayException {
    public AlreadyActiveException(String sessionId) {
        super(ErrorCode.ALREADY_ACTIVE, sessionId, "Session already active: " + sessionId);
    }
}
