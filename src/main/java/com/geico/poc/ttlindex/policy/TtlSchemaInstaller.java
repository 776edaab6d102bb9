package com.geico.poc.ttlindex.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcOperations;

/**
 * Installs and removes the policy table. A worker that finds the table missing
 * skips its passes until it is installed again.
 */
public class TtlSchemaInstaller {

    private static final Logger log = LoggerFactory.getLogger(TtlSchemaInstaller.class);

    private final JdbcOperations jdbc;
    private final TtlPolicyRepository policyRepository;

    public TtlSchemaInstaller(JdbcOperations jdbc, TtlPolicyRepository policyRepository) {
        this.jdbc = jdbc;
        this.policyRepository = policyRepository;
    }

    public void install() {
        log.info("🔧 Installing TTL policy table: " + TtlPolicyRepository.POLICY_TABLE);
        jdbc.execute(
            "CREATE TABLE IF NOT EXISTS " + TtlPolicyRepository.POLICY_TABLE + " (" +
            "  table_name TEXT NOT NULL," +
            "  column_name TEXT NOT NULL," +
            "  expire_after_seconds INTEGER NOT NULL CHECK (expire_after_seconds >= 0)," +
            "  active BOOLEAN NOT NULL DEFAULT true," +
            "  created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
            "  updated_at TIMESTAMPTZ DEFAULT now()," +
            "  last_run TIMESTAMPTZ," +
            "  batch_size INTEGER NOT NULL DEFAULT 10000 CHECK (batch_size > 0)," +
            "  rows_deleted_last_run BIGINT DEFAULT 0," +
            "  total_rows_deleted BIGINT DEFAULT 0," +
            "  index_name TEXT," +
            "  PRIMARY KEY (table_name, column_name)" +
            ")");
        log.info("✅ TTL policy table ready");
    }

    /**
     * Drop the policy table. Supporting indexes on user tables are left in place.
     */
    public void uninstall() {
        jdbc.execute("DROP TABLE IF EXISTS " + TtlPolicyRepository.POLICY_TABLE);
        log.info("🗑️ TTL policy table dropped");
    }

    public boolean isInstalled() {
        return policyRepository.isInstalled();
    }
}
