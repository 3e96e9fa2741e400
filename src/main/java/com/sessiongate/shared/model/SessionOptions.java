package com.sessiongate.shared.model;

import java.util.Map;

public record SessionOptions(
    boolean allowBuffering,
    Map<String, String> metadata
) {
    public SessionOptions {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static SessionOptions defaults() {
        return new SessionOptions(false, Map.of());
    }
}
