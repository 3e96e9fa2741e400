package com.sessiongate.shared.model;

public enum EventKind {
    MESSAGE,
    PRESENCE,
    CONNECTION_UPDATE,
    PAIRING_UPDATE,
    CREDENTIALS_UPDATE
}
