package com.sessiongate.shared.model;

public enum DeliveryStatus {
    PENDING,
    DELIVERED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
