package com.sessiongate.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".sessiongate", "config.yaml"
    );

    public static GatewayConfig load() {
        return load(DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static GatewayConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var db = (Map<String, Object>) raw.getOrDefault("database", Map.of());
        var protocol = (Map<String, Object>) raw.getOrDefault("protocol", Map.of());
        var supervisor = (Map<String, Object>) raw.getOrDefault("supervisor", Map.of());
        var outbound = (Map<String, Object>) raw.getOrDefault("outbound", Map.of());
        var dispatch = (Map<String, Object>) raw.getOrDefault("dispatch", Map.of());
        var webhook = (Map<String, Object>) raw.getOrDefault("webhook", Map.of());

        return new GatewayConfig(
            Integer.parseInt(envOrDefault("SESSIONGATE_PORT",
                String.valueOf(server.getOrDefault("port", 3001)))),
            Map.of(
                "url", envOrDefault("SESSIONGATE_DB_URL",
                    (String) db.getOrDefault("url", "jdbc:postgresql://localhost:5432/sessiongate")),
                "username", envOrDefault("SESSIONGATE_DB_USER",
                    (String) db.getOrDefault("username", "sessiongate")),
                "password", envOrDefault("SESSIONGATE_DB_PASS",
                    (String) db.getOrDefault("password", "sessiongate"))
            ),
            String.valueOf(protocol.getOrDefault("connector", "loopback")),
            parseSupervisorConfig(supervisor),
            parseOutboundConfig(outbound),
            parseDispatchConfig(dispatch),
            parseWebhookConfig(webhook)
        );
    }

    @SuppressWarnings("unchecked")
    private static SupervisorConfig parseSupervisorConfig(Map<String, Object> sup) {
        var defaults = SupervisorConfig.defaults();
        var reconnect = (Map<String, Object>) sup.getOrDefault("reconnect", Map.of());
        var reconnectDef = defaults.reconnect();
        var jitter = parseDouble(reconnect.get("jitter"), reconnectDef.jitter());
        if (jitter < 0 || jitter > 1) {
            throw new IllegalArgumentException("supervisor.reconnect.jitter must be within [0, 1], got: " + jitter);
        }
        return new SupervisorConfig(
            parseLong(sup.get("pairing-timeout-ms"), defaults.pairingTimeoutMs()),
            parseLong(sup.get("heartbeat-timeout-ms"), defaults.heartbeatTimeoutMs()),
            parseLong(sup.get("stop-grace-ms"), defaults.stopGraceMs()),
            parseInt(sup.get("mailbox-capacity"), defaults.mailboxCapacity()),
            parseLong(sup.get("poll-interval-ms"), defaults.pollIntervalMs()),
            new SupervisorConfig.ReconnectConfig(
                parseLong(reconnect.get("base-delay-ms"), reconnectDef.baseDelayMs()),
                parseLong(reconnect.get("max-delay-ms"), reconnectDef.maxDelayMs()),
                parseInt(reconnect.get("max-attempts"), reconnectDef.maxAttempts()),
                jitter
            )
        );
    }

    @SuppressWarnings("unchecked")
    private static OutboundConfig parseOutboundConfig(Map<String, Object> out) {
        var defaults = OutboundConfig.defaults();
        var rate = (Map<String, Object>) out.getOrDefault("rate", Map.of());
        var rateDef = defaults.rate();
        return new OutboundConfig(
            parseLong(out.get("ack-timeout-ms"), defaults.ackTimeoutMs()),
            parseInt(out.get("buffer-capacity"), defaults.bufferCapacity()),
            Boolean.TRUE.equals(out.getOrDefault("allow-buffering", defaults.allowBuffering())),
            parseInt(out.get("max-send-attempts"), defaults.maxSendAttempts()),
            parseInt(out.get("idempotency-window"), defaults.idempotencyWindow()),
            new OutboundConfig.RateConfig(
                parseDouble(rate.get("per-second"), rateDef.perSecond()),
                parseInt(rate.get("burst"), rateDef.burst())
            )
        );
    }

    private static DispatchConfig parseDispatchConfig(Map<String, Object> dispatch) {
        var defaults = DispatchConfig.defaults();
        return new DispatchConfig(
            parseInt(dispatch.get("consumer-buffer-capacity"), defaults.consumerBufferCapacity()),
            parseInt(dispatch.get("threads"), defaults.threads())
        );
    }

    private static WebhookDeliveryConfig parseWebhookConfig(Map<String, Object> webhook) {
        var defaults = WebhookDeliveryConfig.defaults();
        return new WebhookDeliveryConfig(
            parseInt(webhook.get("workers"), defaults.workers()),
            parseInt(webhook.get("max-attempts"), defaults.maxAttempts()),
            parseLong(webhook.get("base-delay-ms"), defaults.baseDelayMs()),
            parseLong(webhook.get("max-delay-ms"), defaults.maxDelayMs()),
            parseLong(webhook.get("timeout-ms"), defaults.timeoutMs())
        );
    }

    private static int parseInt(Object value, int fallback) {
        return value == null ? fallback : Integer.parseInt(String.valueOf(value));
    }

    private static long parseLong(Object value, long fallback) {
        return value == null ? fallback : Long.parseLong(String.valueOf(value));
    }

    private static double parseDouble(Object value, double fallback) {
        return value == null ? fallback : Double.parseDouble(String.valueOf(value));
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
