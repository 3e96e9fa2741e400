package com.sessiongate.shared.model;

import java.util.EnumSet;
import java.util.Set;

public enum SessionState {
    INITIALIZING,
    PAIRING,
    CONNECTED,
    RECONNECTING,
    LOGGED_OUT,
    TERMINATED;

    public boolean isTerminal() {
        return this == LOGGED_OUT || this == TERMINATED;
    }

    /** Any state may stop; only a live or recovering session can be logged out by the remote. */
    public boolean canTransitionTo(SessionState next) {
        return allowedNext().contains(next);
    }

    private Set<SessionState> allowedNext() {
        switch (this) {
            case INITIALIZING:
                return EnumSet.of(PAIRING, CONNECTED, RECONNECTING, TERMINATED);
            case PAIRING:
                return EnumSet.of(CONNECTED, TERMINATED);
            case CONNECTED:
                return EnumSet.of(RECONNECTING, LOGGED_OUT, TERMINATED);
            case RECONNECTING:
                return EnumSet.of(CONNECTED, LOGGED_OUT, TERMINATED);
            default:
                return EnumSet.noneOf(SessionState.class);
        }
    }
}
