package com.geico.poc.ttlindex.config;

import com.geico.poc.ttlindex.lifecycle.RecoveryStateProbe;
import com.geico.poc.ttlindex.lifecycle.WorkerRegistryProbe;
import com.geico.poc.ttlindex.lifecycle.WorkerStartGuard;
import com.geico.poc.ttlindex.policy.ColumnTypeValidator;
import com.geico.poc.ttlindex.policy.TtlPolicyRepository;
import com.geico.poc.ttlindex.policy.TtlSchemaInstaller;
import com.geico.poc.ttlindex.worker.CleanupExecutor;
import com.geico.poc.ttlindex.worker.ExpirationRoutine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Store accessors bound to the pooled {@link JdbcTemplate}.
 *
 * Workers do not use these beans: each builds its own set over its dedicated session
 * (see {@link com.geico.poc.ttlindex.worker.TtlWorkerMain}).
 */
@Configuration
public class TtlStoreConfig {

    @Bean
    public TtlPolicyRepository ttlPolicyRepository(JdbcTemplate jdbcTemplate) {
        return new TtlPolicyRepository(jdbcTemplate);
    }

    @Bean
    public ColumnTypeValidator columnTypeValidator(JdbcTemplate jdbcTemplate) {
        return new ColumnTypeValidator(jdbcTemplate);
    }

    @Bean
    public TtlSchemaInstaller ttlSchemaInstaller(JdbcTemplate jdbcTemplate, TtlPolicyRepository policyRepository) {
        return new TtlSchemaInstaller(jdbcTemplate, policyRepository);
    }

    @Bean
    public WorkerRegistryProbe workerRegistryProbe(JdbcTemplate jdbcTemplate) {
        return new WorkerRegistryProbe(jdbcTemplate);
    }

    @Bean
    public RecoveryStateProbe recoveryStateProbe(JdbcTemplate jdbcTemplate) {
        return new RecoveryStateProbe(jdbcTemplate);
    }

    @Bean
    public WorkerStartGuard workerStartGuard(JdbcTemplate jdbcTemplate) {
        return new WorkerStartGuard(jdbcTemplate);
    }

    @Bean
    public ExpirationRoutine expirationRoutine(JdbcTemplate jdbcTemplate, TtlPolicyRepository policyRepository) {
        return new ExpirationRoutine(jdbcTemplate, policyRepository);
    }

    /**
     * Manual cleanup passes ("run now") on a pooled connection.
     */
    @Bean
    public CleanupExecutor cleanupExecutor(PlatformTransactionManager transactionManager,
                                           TtlPolicyRepository policyRepository,
                                           ExpirationRoutine expirationRoutine) {
        return new CleanupExecutor(transactionManager, policyRepository, expirationRoutine);
    }
}
