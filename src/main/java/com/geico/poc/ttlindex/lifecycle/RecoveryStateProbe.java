package com.geico.poc.ttlindex.lifecycle;

import org.springframework.jdbc.core.JdbcOperations;

/**
 * Reports whether the host store is replaying WAL (a standby, or crash recovery),
 * during which no write may run.
 */
public class RecoveryStateProbe {

    private final JdbcOperations jdbc;

    public RecoveryStateProbe(JdbcOperations jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isInRecovery() {
        Boolean inRecovery = jdbc.queryForObject("SELECT pg_is_in_recovery()", Boolean.class);
        return Boolean.TRUE.equals(inRecovery);
    }
}
