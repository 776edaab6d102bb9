package com.geico.poc.ttlindex.worker;

import com.geico.poc.ttlindex.policy.SqlIdentifiers;
import com.geico.poc.ttlindex.policy.TtlPolicy;
import com.geico.poc.ttlindex.policy.TtlPolicyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcOperations;

import java.time.Instant;
import java.util.List;

/**
 * Deletes expired rows for every active policy.
 *
 * Must run inside a transaction: the runner lock is transaction-scoped, and all
 * deletes and statistics updates of one pass commit or roll back together.
 * Errors are not caught here; see {@link CleanupExecutor}.
 *
 * Rows are removed in batches of the policy's batch size, addressed by ctid,
 * until a batch deletes nothing.
 */
public class ExpirationRoutine {

    private static final Logger log = LoggerFactory.getLogger(ExpirationRoutine.class);

    static final String RUNNER_LOCK_NAME = "pg_ttl_index_runner";

    private final JdbcOperations jdbc;
    private final TtlPolicyRepository policyRepository;

    public ExpirationRoutine(JdbcOperations jdbc, TtlPolicyRepository policyRepository) {
        this.jdbc = jdbc;
        this.policyRepository = policyRepository;
    }

    /**
     * @return total rows deleted across all active policies
     */
    public long run() {
        Boolean locked = jdbc.queryForObject(
            "SELECT pg_try_advisory_xact_lock(hashtext(?))", Boolean.class, RUNNER_LOCK_NAME);
        if (!Boolean.TRUE.equals(locked)) {
            log.info("TTL runner: another instance is already running, skipping");
            return 0;
        }

        Instant startedAt = Instant.now();
        List<TtlPolicy> policies = policyRepository.findActive();
        long totalDeleted = 0;

        for (TtlPolicy policy : policies) {
            long deleted = expire(policy);
            policyRepository.recordRun(policy.getTableName(), policy.getColumnName(), startedAt, deleted);
            if (deleted > 0) {
                log.info("   Expired " + deleted + " rows from " + policy.getTableName() +
                         " (" + policy.getColumnName() + " older than " + policy.getExpireAfterSeconds() + "s)");
            }
            totalDeleted += deleted;
        }

        return totalDeleted;
    }

    long expire(TtlPolicy policy) {
        String sql = deleteStatement(policy.getTableName(), policy.getColumnName());
        long deleted = 0;
        int batch;
        do {
            batch = jdbc.update(sql, policy.getExpireAfterSeconds(), policy.getBatchSize());
            deleted += batch;
            log.debug("   Batch on " + policy.getTableName() + " deleted " + batch + " rows");
        } while (batch > 0);
        return deleted;
    }

    static String deleteStatement(String tableName, String columnName) {
        String table = SqlIdentifiers.quote(tableName);
        String column = SqlIdentifiers.quote(columnName);
        return "DELETE FROM " + table + " WHERE ctid = ANY(ARRAY(" +
               "SELECT ctid FROM " + table +
               " WHERE " + column + " < now() - (? * INTERVAL '1 second')" +
               " LIMIT ?))";
    }
}
