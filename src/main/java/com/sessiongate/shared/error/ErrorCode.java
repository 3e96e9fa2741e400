package com.sessiongate.shared.error;

public enum ErrorCode {
    ALREADY_ACTIVE(false),
    NOT_FOUND(false),
    SESSION_NOT_CONNECTED(false),
    QUEUE_FULL(false),
    PAIRING_TIMEOUT(true),
    PAIRING_REJECTED(true),
    TRANSPORT_DISCONNECTED(false),
    HEARTBEAT_TIMEOUT(false),
    LOGGED_OUT_BY_REMOTE(true),
    RECONNECT_ATTEMPTS_EXHAUSTED(true),
    SEND_TIMEOUT(false),
    SEND_FAILED(false),
    DELIVERY_EXHAUSTED(false),
    INTERNAL_ERROR(true);

    private final boolean terminal;

    ErrorCode(boolean terminal) {
        this.terminal = terminal;
    }

    /** Whether this failure ends the session it occurred in. */
    public boolean terminal() {
        return terminal;
    }
}
