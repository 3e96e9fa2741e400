package com.sessiongate.shared.model;

import java.util.Set;

public record WebhookConfig(
    String url,
    String secret,
    Set<EventKind> enabledKinds
) {
    public WebhookConfig {
        enabledKinds = enabledKinds == null ? Set.of() : Set.copyOf(enabledKinds);
    }

    /** An empty kind set means every kind is delivered. */
    public boolean accepts(EventKind kind) {
        return enabledKinds.isEmpty() || enabledKinds.contains(kind);
    }

    @Override
    public String toString() {
        return "WebhookConfig[url=" + url + ", enabledKinds=" + enabledKinds + "]";
    }
}
