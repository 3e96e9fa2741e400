package com.sessiongate.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.lang.management.ManagementFactory;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;

public class HealthCheck {

    private static final Logger log = LoggerFactory.getLogger(HealthCheck.class);

    private final DataSource dataSource;
    private final LongSupplier activeSessions;

    public HealthCheck(DataSource dataSource, LongSupplier activeSessions) {
        this.dataSource = dataSource;
        this.activeSessions = activeSessions;
    }

    public Map<String, Object> run() {
        var result = new LinkedHashMap<String, Object>();
        var databaseOk = checkDatabase();
        result.put("status", databaseOk ? "ok" : "degraded");
        result.put("timestamp", Instant.now().toString());
        result.put("uptimeMs", ManagementFactory.getRuntimeMXBean().getUptime());
        result.put("activeSessions", activeSessions.getAsLong());
        result.put("database", databaseOk ? "connected" : "disconnected");
        return result;
    }

    private boolean checkDatabase() {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("SELECT 1");
             var rs = ps.executeQuery()) {
            return true;
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
