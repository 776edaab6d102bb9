package com.geico.poc.ttlindex.lifecycle;

import org.springframework.jdbc.core.JdbcOperations;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Finds TTL worker sessions in the store's live-session catalog.
 *
 * A worker is identified by its session's application_name,
 * {@value #WORKER_NAME_PREFIX}followed by the database oid.
 */
public class WorkerRegistryProbe {

    public static final String WORKER_NAME_PREFIX = "TTL Worker DB ";

    private static final String WORKER_NAME_PATTERN = WORKER_NAME_PREFIX + "%";

    private final JdbcOperations jdbc;

    public WorkerRegistryProbe(JdbcOperations jdbc) {
        this.jdbc = jdbc;
    }

    public static String workerName(long databaseOid) {
        return WORKER_NAME_PREFIX + databaseOid;
    }

    /**
     * Whether a worker session is live for the current database.
     */
    public boolean isWorkerRunning() {
        Boolean running = jdbc.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM pg_stat_activity " +
            "WHERE datname = current_database() AND application_name LIKE ?)",
            Boolean.class, WORKER_NAME_PATTERN);
        return Boolean.TRUE.equals(running);
    }

    /**
     * Backend pids of live worker sessions for the current database.
     */
    public List<Integer> findWorkerPids() {
        return jdbc.queryForList(
            "SELECT pid FROM pg_stat_activity " +
            "WHERE datname = current_database() AND application_name LIKE ? " +
            "ORDER BY backend_start",
            Integer.class, WORKER_NAME_PATTERN);
    }

    /**
     * Ask the store to terminate a backend. Does not wait for it to exit.
     *
     * @return true if the termination signal was sent
     */
    public boolean terminateBackend(int pid) {
        Boolean sent = jdbc.queryForObject("SELECT pg_terminate_backend(?)", Boolean.class, pid);
        return Boolean.TRUE.equals(sent);
    }

    /**
     * Every worker session on the server, newest first.
     */
    public List<WorkerStatus> listWorkers() {
        return jdbc.query(
            "SELECT pid, application_name, state, backend_start, state_change, query_start, datname " +
            "FROM pg_stat_activity WHERE application_name LIKE ? " +
            "ORDER BY backend_start DESC",
            (rs, rowNum) -> {
                WorkerStatus status = new WorkerStatus();
                status.setWorkerPid(rs.getInt("pid"));
                status.setApplicationName(rs.getString("application_name"));
                status.setState(rs.getString("state"));
                status.setBackendStart(toInstant(rs.getTimestamp("backend_start")));
                status.setStateChange(toInstant(rs.getTimestamp("state_change")));
                status.setQueryStart(toInstant(rs.getTimestamp("query_start")));
                status.setDatabaseName(rs.getString("datname"));
                return status;
            },
            WORKER_NAME_PATTERN);
    }

    public long currentDatabaseOid() {
        Long oid = jdbc.queryForObject(
            "SELECT CAST(oid AS BIGINT) FROM pg_database WHERE datname = current_database()", Long.class);
        return oid != null ? oid : 0L;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
