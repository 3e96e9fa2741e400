package com.sessiongate.supervisor;

import com.sessiongate.dispatch.EventDispatcher;
import com.sessiongate.observability.GatewayMetrics;
import com.sessiongate.observability.GatewayObservabilitySink;
import com.sessiongate.protocol.ProtocolConnector;
import com.sessiongate.sessions.CredentialStore;
import com.sessiongate.shared.config.SupervisorConfig;

/**
 * Collaborators shared by every supervisor.
 */
public record SupervisorContext(
    SupervisorConfig config,
    long ackTimeoutMs,
    ProtocolConnector connector,
    CredentialStore credentials,
    EventDispatcher dispatcher,
    BackoffPolicy backoff,
    GatewayObservabilitySink observability,
    GatewayMetrics metrics
) {}
