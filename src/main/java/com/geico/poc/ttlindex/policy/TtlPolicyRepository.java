package com.geico.poc.ttlindex.policy;

import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes the policy table ({@value #POLICY_TABLE}).
 *
 * Instances are bound to one {@link JdbcOperations}: the pooled template for the
 * registration API, or a worker's dedicated session. Statements join whatever
 * transaction is active on that connection.
 */
public class TtlPolicyRepository {

    public static final String POLICY_TABLE = "ttl_index_table";

    private static final String SELECT_COLUMNS =
        "SELECT table_name, column_name, expire_after_seconds, batch_size, active, " +
        "created_at, updated_at, last_run, " +
        "CAST(EXTRACT(EPOCH FROM now() - last_run) AS BIGINT) AS seconds_since_last_run, " +
        "rows_deleted_last_run, total_rows_deleted, index_name " +
        "FROM " + POLICY_TABLE;

    private static final RowMapper<TtlPolicy> POLICY_ROW_MAPPER = TtlPolicyRepository::mapPolicy;

    private final JdbcOperations jdbc;

    public TtlPolicyRepository(JdbcOperations jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Whether the policy table exists in the current schema. This is the
     * "extension still installed" check made at the start of every cleanup pass.
     */
    public boolean isInstalled() {
        Boolean installed = jdbc.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM information_schema.tables " +
            "WHERE table_schema = current_schema() AND table_name = ?)",
            Boolean.class, POLICY_TABLE);
        return Boolean.TRUE.equals(installed);
    }

    /**
     * Insert a policy, or overwrite threshold and batch size of an existing one and reactivate it.
     */
    public void upsert(String tableName, String columnName, int expireAfterSeconds, int batchSize, String indexName) {
        jdbc.update(
            "INSERT INTO " + POLICY_TABLE + " " +
            "(table_name, column_name, expire_after_seconds, batch_size, index_name, active, created_at) " +
            "VALUES (?, ?, ?, ?, ?, true, now()) " +
            "ON CONFLICT (table_name, column_name) DO UPDATE SET " +
            "expire_after_seconds = EXCLUDED.expire_after_seconds, " +
            "batch_size = EXCLUDED.batch_size, " +
            "index_name = COALESCE(EXCLUDED.index_name, " + POLICY_TABLE + ".index_name), " +
            "active = true, " +
            "updated_at = now()",
            tableName, columnName, expireAfterSeconds, batchSize, indexName);
    }

    /**
     * @return true iff a policy row was removed
     */
    public boolean delete(String tableName, String columnName) {
        int removed = jdbc.update(
            "DELETE FROM " + POLICY_TABLE + " WHERE table_name = ? AND column_name = ?",
            tableName, columnName);
        return removed > 0;
    }

    /**
     * @return true iff a policy row was found
     */
    public boolean setActive(String tableName, String columnName, boolean active) {
        int updated = jdbc.update(
            "UPDATE " + POLICY_TABLE + " SET active = ?, updated_at = now() " +
            "WHERE table_name = ? AND column_name = ?",
            active, tableName, columnName);
        return updated > 0;
    }

    public Optional<TtlPolicy> find(String tableName, String columnName) {
        List<TtlPolicy> found = jdbc.query(
            SELECT_COLUMNS + " WHERE table_name = ? AND column_name = ?",
            POLICY_ROW_MAPPER, tableName, columnName);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public List<TtlPolicy> findAll() {
        return jdbc.query(SELECT_COLUMNS + " ORDER BY table_name, column_name", POLICY_ROW_MAPPER);
    }

    public List<TtlPolicy> findActive() {
        return jdbc.query(SELECT_COLUMNS + " WHERE active = true ORDER BY table_name, column_name",
            POLICY_ROW_MAPPER);
    }

    /**
     * Record the outcome of one policy's expiration within a pass.
     */
    public void recordRun(String tableName, String columnName, Instant startedAt, long rowsDeleted) {
        jdbc.update(
            "UPDATE " + POLICY_TABLE + " SET last_run = ?, rows_deleted_last_run = ?, " +
            "total_rows_deleted = total_rows_deleted + ? " +
            "WHERE table_name = ? AND column_name = ?",
            Timestamp.from(startedAt), rowsDeleted, rowsDeleted, tableName, columnName);
    }

    private static TtlPolicy mapPolicy(ResultSet rs, int rowNum) throws SQLException {
        TtlPolicy policy = new TtlPolicy();
        policy.setTableName(rs.getString("table_name"));
        policy.setColumnName(rs.getString("column_name"));
        policy.setExpireAfterSeconds(rs.getInt("expire_after_seconds"));
        policy.setBatchSize(rs.getInt("batch_size"));
        policy.setActive(rs.getBoolean("active"));
        policy.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
        policy.setUpdatedAt(toInstant(rs.getTimestamp("updated_at")));
        policy.setLastRun(toInstant(rs.getTimestamp("last_run")));
        long sinceLastRun = rs.getLong("seconds_since_last_run");
        policy.setSecondsSinceLastRun(rs.wasNull() ? null : sinceLastRun);
        policy.setRowsDeletedLastRun(rs.getLong("rows_deleted_last_run"));
        policy.setTotalRowsDeleted(rs.getLong("total_rows_deleted"));
        policy.setIndexName(rs.getString("index_name"));
        return policy;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
