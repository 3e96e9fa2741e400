package com.sessiongate.observability;

import com.sessiongate.shared.error.ErrorCode;
import com.sessiongate.shared.model.SessionState;
import com.sessiongate.shared.model.WebhookDeliveryTask;

/**
 * Receives lifecycle and failure reports from the orchestration core.
 * Implementations can provide logging, metrics, or alerting. Calls may come from any thread.
 */
public interface GatewayObservabilitySink {

    /**
     * Called after a session moved to a new state.
     * @param reason the failure that caused the move, or null for a normal transition
     */
    void onStateTransition(String sessionId, SessionState from, SessionState to, ErrorCode reason);

    /**
     * Called when a consumer lane discarded its oldest pending event.
     * @param totalDropped running total for that session and consumer
     */
    void onEventsDropped(String sessionId, String consumer, long totalDropped);

    /**
     * Called exactly once for each webhook task that used up its retries.
     */
    void onDeliveryExhausted(WebhookDeliveryTask task);

    void onError(String sessionId, ErrorCode code, String message, Throwable cause);
}
