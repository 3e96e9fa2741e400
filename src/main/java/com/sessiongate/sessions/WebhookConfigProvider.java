package com.sessiongate.sessions;

import com.sessiongate.shared.model.WebhookConfig;

import java.util.Optional;

@FunctionalInterface
public interface WebhookConfigProvider {
    Optional<WebhookConfig> getWebhookConfig(String sessionId);
}
