package com.geico.poc.ttlindex.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcOperations;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.function.Supplier;

/**
 * Serialises worker start-up across every client of the database.
 *
 * Holds a session-level advisory lock on one pooled connection while the
 * check-then-register sequence runs, so two concurrent starts cannot both see
 * "not running" and both register a worker.
 */
public class WorkerStartGuard {

    private static final Logger log = LoggerFactory.getLogger(WorkerStartGuard.class);

    static final String START_LOCK_NAME = "pg_ttl_index_worker_start";

    private final JdbcOperations jdbc;

    public WorkerStartGuard(JdbcOperations jdbc) {
        this.jdbc = jdbc;
    }

    public <T> T runExclusively(Supplier<T> action) {
        return jdbc.execute((ConnectionCallback<T>) connection -> {
            callLockFunction(connection, "SELECT pg_advisory_lock(hashtext(?))");
            try {
                return action.get();
            } finally {
                unlockQuietly(connection);
            }
        });
    }

    private void callLockFunction(Connection connection, String sql) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, START_LOCK_NAME);
            ps.execute();
        }
    }

    private void unlockQuietly(Connection connection) {
        try {
            callLockFunction(connection, "SELECT pg_advisory_unlock(hashtext(?))");
        } catch (SQLException e) {
            // Only fails on a broken connection, and the lock goes away with its session
            log.debug("Could not release worker start lock: " + e.getMessage());
        }
    }
}
