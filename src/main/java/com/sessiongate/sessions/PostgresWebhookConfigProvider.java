package com.sessiongate.sessions;

import com.sessiongate.shared.model.EventKind;
import com.sessiongate.shared.model.WebhookConfig;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

public class PostgresWebhookConfigProvider implements WebhookConfigProvider {

    private final DataSource dataSource;

    public PostgresWebhookConfigProvider(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<WebhookConfig> getWebhookConfig(String sessionId) {
        var sql = "SELECT url, secret, enabled_kinds FROM session_webhooks WHERE session_id = ? AND active";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new WebhookConfig(
                        rs.getString("url"),
                        rs.getString("secret"),
                        parseKinds(rs.getString("enabled_kinds"))));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load webhook config: " + sessionId, e);
        }
    }

    static Set<EventKind> parseKinds(String raw) {
        if (raw == null || raw.isBlank()) return Set.of();
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> EventKind.valueOf(s.toUpperCase()))
                .collect(Collectors.toSet());
    }
}
