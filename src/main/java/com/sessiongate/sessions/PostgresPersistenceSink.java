package com.sessiongate.sessions;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessiongate.shared.model.Credential;
import com.sessiongate.shared.model.ProtocolEvent;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Optional;

public class PostgresPersistenceSink implements PersistenceSink {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final DataSource dataSource;

    public PostgresPersistenceSink(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void persistEvent(String sessionId, ProtocolEvent event) {
        // replays after a restart hit the primary key and are ignored
        var sql = "INSERT INTO session_events (session_id, sequence, kind, payload, received_at) "
                + "VALUES (?, ?, ?, ?::jsonb, ?) ON CONFLICT (session_id, sequence) DO NOTHING";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            ps.setLong(2, event.sequence());
            ps.setString(3, event.kind().name());
            ps.setString(4, MAPPER.writeValueAsString(event.payload()));
            ps.setTimestamp(5, Timestamp.from(event.receivedAt()));
            ps.executeUpdate();
        } catch (Exception e) {
            throw new RuntimeException("Failed to persist event " + event.deliveryKey(), e);
        }
    }

    @Override
    public boolean persistCredential(String sessionId, Credential credential) {
        // last writer wins by version, decided by the database row lock
        var sql = "INSERT INTO session_credentials (session_id, blob, version, rotated_at) VALUES (?, ?, ?, ?) "
                + "ON CONFLICT (session_id) DO UPDATE SET blob = EXCLUDED.blob, version = EXCLUDED.version, "
                + "rotated_at = EXCLUDED.rotated_at WHERE session_credentials.version <= EXCLUDED.version";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            ps.setString(2, credential.blob());
            ps.setLong(3, credential.version());
            ps.setTimestamp(4, Timestamp.from(credential.rotatedAt()));
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to persist credential: " + sessionId, e);
        }
    }

    @Override
    public Optional<Credential> loadCredential(String sessionId) {
        var sql = "SELECT blob, version, rotated_at FROM session_credentials WHERE session_id = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new Credential(
                        sessionId,
                        rs.getString("blob"),
                        rs.getLong("version"),
                        rs.getTimestamp("rotated_at").toInstant()));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load credential: " + sessionId, e);
        }
    }

    @Override
    public void deleteCredential(String sessionId) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("DELETE FROM session_credentials WHERE session_id = ?")) {
            ps.setString(1, sessionId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete credential: " + sessionId, e);
        }
    }

    @Override
    public long lastSequence(String sessionId) {
        var sql = "SELECT COALESCE(MAX(sequence), 0) FROM session_events WHERE session_id = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read last sequence: " + sessionId, e);
        }
    }
}
