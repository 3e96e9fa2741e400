package com.sessiongate.shared.error;

public class GatewayException extends RuntimeException {

    private final ErrorCode code;
    private final String sessionId;

    public GatewayException(ErrorCode code, String sessionId, String message) {
        this(code, sessionId, message, null);
    }

    public GatewayException(ErrorCode code, String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.sessionId = sessionId;
    }

    public ErrorCode code() {
        return code;
    }

    public String sessionId() {
        return sessionId;
    }
}
