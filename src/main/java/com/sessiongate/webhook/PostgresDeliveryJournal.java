package com.sessiongate.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sessiongate.shared.model.DeliveryStatus;
import com.sessiongate.shared.model.ProtocolEvent;
import com.sessiongate.shared.model.WebhookDeliveryTask;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

public class PostgresDeliveryJournal implements DeliveryJournal {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final DataSource dataSource;

    public PostgresDeliveryJournal(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void record(WebhookDeliveryTask task) {
        var sql = "INSERT INTO webhook_deliveries (task_id, session_id, sequence, url, event, attempts, "
                + "next_attempt_at, status, last_status_code, updated_at) "
                + "VALUES (?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, NOW()) "
                + "ON CONFLICT (task_id) DO UPDATE SET attempts = EXCLUDED.attempts, "
                + "next_attempt_at = EXCLUDED.next_attempt_at, status = EXCLUDED.status, "
                + "last_status_code = EXCLUDED.last_status_code, updated_at = NOW()";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            var event = task.event();
            ps.setString(1, task.taskId());
            ps.setString(2, event.sessionId());
            ps.setLong(3, event.sequence());
            ps.setString(4, task.url());
            ps.setString(5, MAPPER.writeValueAsString(event));
            ps.setInt(6, task.attempts());
            ps.setTimestamp(7, Timestamp.from(task.nextAttemptAt()));
            ps.setString(8, task.status().name());
            ps.setInt(9, task.lastStatusCode());
            ps.executeUpdate();
        } catch (Exception e) {
            throw new RuntimeException("Failed to journal webhook task " + task.taskId(), e);
        }
    }

    @Override
    public List<WebhookDeliveryTask> pending() {
        var sql = "SELECT url, event, attempts, next_attempt_at, last_status_code FROM webhook_deliveries "
                + "WHERE status = 'PENDING' ORDER BY session_id, sequence";
        var tasks = new ArrayList<WebhookDeliveryTask>();
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql);
             var rs = ps.executeQuery()) {
            while (rs.next()) {
                var event = MAPPER.readValue(rs.getString("event"), ProtocolEvent.class);
                tasks.add(new WebhookDeliveryTask(
                        event,
                        rs.getString("url"),
                        null,
                        rs.getInt("attempts"),
                        rs.getTimestamp("next_attempt_at").toInstant(),
                        DeliveryStatus.PENDING,
                        rs.getInt("last_status_code")));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load pending webhook tasks", e);
        } catch (Exception e) {
            throw new RuntimeException("Failed to decode journaled webhook event", e);
        }
        return tasks;
    }

    @Override
    public long lastSequence(String sessionId) {
        var sql = "SELECT COALESCE(MAX(sequence), 0) FROM webhook_deliveries WHERE session_id = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read journaled sequence: " + sessionId, e);
        }
    }
}
