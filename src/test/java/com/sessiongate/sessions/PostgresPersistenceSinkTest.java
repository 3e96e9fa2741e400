package com.sessiongate.sessions;

import com.sessiongate.shared.model.Credential;
import com.sessiongate.shared.model.EventKind;
import com.sessiongate.shared.model.ProtocolEvent;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PostgresPersistenceSinkTest {

    private PreparedStatement ps;

    private DataSource dataSource() throws SQLException {
        ps = mock(PreparedStatement.class);
        var conn = mock(Connection.class);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenReturn(conn);
        return ds;
    }

    @Test
    void persistEventWritesJsonPayload() throws Exception {
        var sink = new PostgresPersistenceSink(dataSource());
        var event = new ProtocolEvent("s1", 4, EventKind.MESSAGE, Map.of("text", "hi"), Instant.now());

        sink.persistEvent("s1", event);

        verify(ps).setString(1, "s1");
        verify(ps).setLong(2, 4);
        verify(ps).setString(3, "MESSAGE");
        verify(ps).setString(4, "{\"text\":\"hi\"}");
        verify(ps).executeUpdate();
    }

    @Test
    void persistCredentialUpsertsByVersion() throws Exception {
        var sink = new PostgresPersistenceSink(dataSource());
        when(ps.executeUpdate()).thenReturn(1);

        assertTrue(sink.persistCredential("s1", new Credential("s1", "blob", 9, Instant.now())));

        verify(ps).setString(2, "blob");
        verify(ps).setLong(3, 9);
        verify(ps).executeUpdate();
    }

    @Test
    void persistCredentialReportsRowKeptByVersionGuard() throws Exception {
        var sink = new PostgresPersistenceSink(dataSource());
        when(ps.executeUpdate()).thenReturn(0);

        assertFalse(sink.persistCredential("s1", new Credential("s1", "old", 70, Instant.now())));
    }

    @Test
    void loadCredentialMapsRow() throws Exception {
        var sink = new PostgresPersistenceSink(dataSource());
        var rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(true);
        when(rs.getString("blob")).thenReturn("blob");
        when(rs.getLong("version")).thenReturn(2L);
        when(rs.getTimestamp("rotated_at")).thenReturn(Timestamp.from(Instant.parse("2024-01-01T00:00:00Z")));
        when(ps.executeQuery()).thenReturn(rs);

        var credential = sink.loadCredential("s1").orElseThrow();

        assertEquals("s1", credential.sessionId());
        assertEquals(2, credential.version());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), credential.rotatedAt());
    }

    @Test
    void lastSequenceDefaultsToZero() throws Exception {
        var sink = new PostgresPersistenceSink(dataSource());
        var rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(false);
        when(ps.executeQuery()).thenReturn(rs);

        assertEquals(0, sink.lastSequence("s1"));
    }

    @Test
    void sqlFailureNamesTheSession() throws Exception {
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenThrow(new SQLException("down"));
        var sink = new PostgresPersistenceSink(ds);

        var ex = assertThrows(RuntimeException.class, () -> sink.deleteCredential("s1"));
        assertTrue(ex.getMessage().contains("s1"));
    }
}
