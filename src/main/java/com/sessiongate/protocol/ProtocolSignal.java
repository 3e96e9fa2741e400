package com.sessiongate.protocol;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A raw callback from the protocol layer, before sequencing.
 */
public record ProtocolSignal(Type type, Map<String, Object> payload, Instant receivedAt) {

    public enum Type {
        PAIRING_CHALLENGE,
        PAIRED,
        PAIRING_REJECTED,
        CREDENTIALS_UPDATE,
        MESSAGE,
        PRESENCE,
        HEARTBEAT,
        DISCONNECTED,
        LOGGED_OUT
    }

    public ProtocolSignal {
        // connectors may report absent fields as null values
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static ProtocolSignal of(Type type, Map<String, Object> payload) {
        return new ProtocolSignal(type, payload, Instant.now());
    }

    public static ProtocolSignal pairingChallenge(String challenge) {
        return of(Type.PAIRING_CHALLENGE, Map.of("challenge", challenge));
    }

    public static ProtocolSignal paired(String credentialBlob) {
        return of(Type.PAIRED, Map.of("blob", credentialBlob));
    }

    public static ProtocolSignal pairingRejected(String reason) {
        return of(Type.PAIRING_REJECTED, Map.of("reason", reason));
    }

    public static ProtocolSignal credentialsUpdate(String credentialBlob) {
        return of(Type.CREDENTIALS_UPDATE, Map.of("blob", credentialBlob));
    }

    public static ProtocolSignal message(Map<String, Object> payload) {
        return of(Type.MESSAGE, payload);
    }

    public static ProtocolSignal presence(Map<String, Object> payload) {
        return of(Type.PRESENCE, payload);
    }

    public static ProtocolSignal heartbeat() {
        return of(Type.HEARTBEAT, Map.of());
    }

    public static ProtocolSignal disconnected(String reason) {
        return of(Type.DISCONNECTED, Map.of("reason", reason));
    }

    public static ProtocolSignal loggedOut(String reason) {
        return of(Type.LOGGED_OUT, Map.of("reason", reason));
    }

    public String blob() {
        return (String) payload.get("blob");
    }

    public String reason() {
        return String.valueOf(payload.getOrDefault("reason", "unknown"));
    }

    @Override
    public String toString() {
        // credential blobs stay out of logs
        var shown = payload.containsKey("blob") ? Map.of("blob", "[REDACTED]") : payload;
        return "ProtocolSignal[" + type + ", " + shown + "]";
    }
}
