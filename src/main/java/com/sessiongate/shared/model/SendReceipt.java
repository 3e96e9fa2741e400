package com.sessiongate.shared.model;

import java.time.Instant;

public record SendReceipt(
    String sessionId,
    String idempotencyKey,
    String messageId,
    int attempts,
    Instant acknowledgedAt
) {}
