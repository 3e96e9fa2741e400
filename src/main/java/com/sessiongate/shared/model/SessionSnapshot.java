package com.sessiongate.shared.model;

import com.sessiongate.shared.error.ErrorCode;

import java.time.Instant;

/**
 * Point-in-time view of a session. {@code lastError} and {@code pairingChallenge} may be null.
 */
public record SessionSnapshot(
    String sessionId,
    SessionState state,
    Instant lastSeen,
    int reconnectAttempts,
    long totalReconnectAttempts,
    ErrorCode lastError,
    String pairingChallenge,
    int pendingOutbound
) {}
