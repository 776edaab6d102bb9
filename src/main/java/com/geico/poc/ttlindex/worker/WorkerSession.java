package com.geico.poc.ttlindex.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A worker's dedicated store session: one physical connection, never pooled,
 * with its own template and transaction manager.
 */
public class WorkerSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerSession.class);

    private final Connection connection;
    private final JdbcTemplate jdbcTemplate;
    private final DataSourceTransactionManager transactionManager;
    private final int backendPid;
    private final long databaseOid;

    WorkerSession(Connection connection, JdbcTemplate jdbcTemplate,
                  DataSourceTransactionManager transactionManager, int backendPid, long databaseOid) {
        this.connection = connection;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionManager = transactionManager;
        this.backendPid = backendPid;
        this.databaseOid = databaseOid;
    }

    public JdbcTemplate getJdbcTemplate() {
        return jdbcTemplate;
    }

    public DataSourceTransactionManager getTransactionManager() {
        return transactionManager;
    }

    public int getBackendPid() {
        return backendPid;
    }

    public long getDatabaseOid() {
        return databaseOid;
    }

    /**
     * Close the connection. The backend may already be gone (terminated), so failures
     * are logged and dropped.
     */
    @Override
    public void close() {
        closeQuietly(connection);
    }

    static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Ignoring failure closing worker session: " + e.getMessage());
        }
    }
}
