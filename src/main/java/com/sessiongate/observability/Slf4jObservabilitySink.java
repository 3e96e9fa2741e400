package com.sessiongate.observability;

import com.sessiongate.shared.error.ErrorCode;
import com.sessiongate.shared.model.SessionState;
import com.sessiongate.shared.model.WebhookDeliveryTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Slf4jObservabilitySink implements GatewayObservabilitySink {

    private static final Logger log = LoggerFactory.getLogger(Slf4jObservabilitySink.class);

    @Override
    public void onStateTransition(String sessionId, SessionState from, SessionState to, ErrorCode reason) {
        if (reason == null) {
            log.info("Session {}: {} -> {}", sessionId, from, to);
        } else if (reason.terminal()) {
            log.error("Session {}: {} -> {} ({})", sessionId, from, to, reason);
        } else {
            log.warn("Session {}: {} -> {} ({})", sessionId, from, to, reason);
        }
    }

    @Override
    public void onEventsDropped(String sessionId, String consumer, long totalDropped) {
        log.warn("Session {}: consumer '{}' is behind, dropped oldest event (total dropped {})",
                sessionId, consumer, totalDropped);
    }

    @Override
    public void onDeliveryExhausted(WebhookDeliveryTask task) {
        log.error("Webhook delivery exhausted: {}", task);
    }

    @Override
    public void onError(String sessionId, ErrorCode code, String message, Throwable cause) {
        if (code.terminal()) {
            log.error("Session {} [{}]: {}", sessionId, code, message, cause);
        } else {
            log.warn("Session {} [{}]: {}", sessionId, code, message, cause);
        }
    }
}
