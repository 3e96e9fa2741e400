package com.sessiongate.shared.config;

import java.util.Map;

public record GatewayConfig(
    int serverPort,
    Map<String, String> database,
    String protocolConnector,
    SupervisorConfig supervisor,
    OutboundConfig outbound,
    DispatchConfig dispatch,
    WebhookDeliveryConfig webhook
) {
    public static GatewayConfig defaults() {
        return new GatewayConfig(
            3001,
            Map.of(),
            "loopback",
            SupervisorConfig.defaults(),
            OutboundConfig.defaults(),
            DispatchConfig.defaults(),
            WebhookDeliveryConfig.defaults()
        );
    }
}
