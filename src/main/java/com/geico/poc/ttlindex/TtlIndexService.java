package com.geico.poc.ttlindex;

import com.geico.poc.ttlindex.config.TtlIndexConfig;
import com.geico.poc.ttlindex.policy.ColumnTypeValidator;
import com.geico.poc.ttlindex.policy.InvalidTtlIndexException;
import com.geico.poc.ttlindex.policy.SqlIdentifiers;
import com.geico.poc.ttlindex.policy.TtlPolicy;
import com.geico.poc.ttlindex.policy.TtlPolicyRepository;
import com.geico.poc.ttlindex.policy.TtlSchemaInstaller;
import com.geico.poc.ttlindex.worker.CleanupExecutor;
import com.geico.poc.ttlindex.worker.CleanupResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Registration API for TTL policies.
 *
 * Each operation runs in one transaction on a pooled connection. Validation errors
 * surface as {@link InvalidTtlIndexException}; store failures propagate as Spring
 * {@link org.springframework.dao.DataAccessException}s.
 */
@Service
public class TtlIndexService {

    private static final Logger log = LoggerFactory.getLogger(TtlIndexService.class);

    @Autowired
    private TtlIndexConfig config;

    @Autowired
    private TtlPolicyRepository policyRepository;

    @Autowired
    private ColumnTypeValidator columnTypeValidator;

    @Autowired
    private TtlSchemaInstaller schemaInstaller;

    @Autowired
    private CleanupExecutor cleanupExecutor;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TransactionTemplate transactionTemplate;

    public boolean createIndex(String tableName, String columnName, int expireAfterSeconds) {
        return createIndex(tableName, columnName, expireAfterSeconds, null);
    }

    /**
     * Register (or update and reactivate) the policy for {@code table.column}.
     *
     * @param batchSize rows per delete statement, null for the configured default
     * @throws InvalidTtlIndexException if an argument is out of range or the column is
     *         missing or not date/timestamp; nothing is written in that case
     */
    public boolean createIndex(String tableName, String columnName, int expireAfterSeconds, Integer batchSize) {
        requireName(tableName, "table name");
        requireName(columnName, "column name");
        if (expireAfterSeconds < 1) {
            throw new InvalidTtlIndexException("expire_after_seconds must be at least 1, got " + expireAfterSeconds);
        }
        int effectiveBatchSize = batchSize != null ? batchSize : config.getDefaultBatchSize();
        if (effectiveBatchSize < 1) {
            throw new InvalidTtlIndexException("batch_size must be at least 1, got " + effectiveBatchSize);
        }

        Boolean created = transactionTemplate.execute(status -> {
            columnTypeValidator.requireTemporal(tableName, columnName);

            String indexName = null;
            if (config.isCreateSupportingIndex()) {
                indexName = chooseIndexName(tableName, columnName);
                jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS " + SqlIdentifiers.quote(indexName) +
                                     " ON " + SqlIdentifiers.quote(tableName) +
                                     " (" + SqlIdentifiers.quote(columnName) + ")");
            }

            policyRepository.upsert(tableName, columnName, expireAfterSeconds, effectiveBatchSize, indexName);
            return true;
        });

        log.info("📋 TTL policy set: " + tableName + "." + columnName +
                 " expires after " + expireAfterSeconds + "s (batch " + effectiveBatchSize + ")");
        return Boolean.TRUE.equals(created);
    }

    /**
     * Remove the policy for {@code table.column} and its supporting index.
     *
     * @return true iff a policy was removed
     */
    public boolean dropIndex(String tableName, String columnName) {
        Boolean dropped = transactionTemplate.execute(status -> {
            Optional<TtlPolicy> existing = policyRepository.find(tableName, columnName);
            if (existing.isEmpty()) {
                return false;
            }

            String indexName = existing.get().getIndexName();
            if (indexName != null && indexTable(indexName).map(tableName::equals).orElse(false)) {
                jdbcTemplate.execute("DROP INDEX IF EXISTS " + SqlIdentifiers.quote(indexName));
            }
            return policyRepository.delete(tableName, columnName);
        });

        if (Boolean.TRUE.equals(dropped)) {
            log.info("🗑️ TTL policy dropped: " + tableName + "." + columnName);
            return true;
        }
        return false;
    }

    /**
     * Soft-enable or disable a policy without losing its settings.
     *
     * @return true iff the policy exists
     */
    public boolean setActive(String tableName, String columnName, boolean active) {
        boolean found = policyRepository.setActive(tableName, columnName, active);
        if (found) {
            log.info("TTL policy " + tableName + "." + columnName + (active ? " activated" : " deactivated"));
        }
        return found;
    }

    public Optional<TtlPolicy> getIndex(String tableName, String columnName) {
        return policyRepository.find(tableName, columnName);
    }

    public List<TtlPolicy> summary() {
        return policyRepository.findAll();
    }

    /**
     * Run one cleanup pass now, outside the worker's schedule.
     */
    public CleanupResult runNow() {
        CleanupResult result = cleanupExecutor.runCleanupPass();
        if (result.isFailed()) {
            log.warn("⚠️  Manual TTL cleanup failed: " + result.getError().getMessage());
        } else {
            log.info("Manual TTL cleanup: " + result);
        }
        return result;
    }

    public void install() {
        schemaInstaller.install();
    }

    public void uninstall() {
        schemaInstaller.uninstall();
    }

    public boolean isInstalled() {
        return schemaInstaller.isInstalled();
    }

    /**
     * The plain supporting index name, unless an index of that name already belongs to
     * another table; then the hashed form.
     */
    private String chooseIndexName(String tableName, String columnName) {
        String indexName = SqlIdentifiers.supportingIndexName(tableName, columnName);
        Optional<String> owner = indexTable(indexName);
        if (owner.isPresent() && !owner.get().equals(tableName)) {
            String hashed = SqlIdentifiers.hashedIndexName(tableName, columnName);
            log.info("Index " + indexName + " belongs to " + owner.get() + ", using " + hashed);
            return hashed;
        }
        return indexName;
    }

    /**
     * Table the named index is defined on, in the current schema.
     */
    private Optional<String> indexTable(String indexName) {
        List<String> tables = jdbcTemplate.queryForList(
            "SELECT tablename FROM pg_indexes WHERE schemaname = current_schema() AND indexname = ?",
            String.class, indexName);
        return tables.isEmpty() ? Optional.empty() : Optional.ofNullable(tables.get(0));
    }

    private static void requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new InvalidTtlIndexException(what + " must not be empty");
        }
    }
}
