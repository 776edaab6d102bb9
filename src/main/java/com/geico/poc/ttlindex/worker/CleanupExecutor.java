package com.geico.poc.ttlindex.worker;

import com.geico.poc.ttlindex.policy.TtlPolicyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * Runs one self-contained transactional cleanup pass.
 *
 * Never throws: any error raised during the pass is captured into a failed
 * {@link CleanupResult} after the transaction has been aborted. There is no retry;
 * the next chance is the worker's next scheduled wake.
 */
public class CleanupExecutor {

    private static final Logger log = LoggerFactory.getLogger(CleanupExecutor.class);

    private final PlatformTransactionManager transactionManager;
    private final TtlPolicyRepository policyRepository;
    private final ExpirationRoutine expirationRoutine;
    private final TransactionDefinition definition;

    public CleanupExecutor(PlatformTransactionManager transactionManager,
                           TtlPolicyRepository policyRepository,
                           ExpirationRoutine expirationRoutine) {
        this.transactionManager = transactionManager;
        this.policyRepository = policyRepository;
        this.expirationRoutine = expirationRoutine;

        DefaultTransactionDefinition def = new DefaultTransactionDefinition(
            TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        def.setName("ttl-cleanup-pass");
        this.definition = def;
    }

    public CleanupResult runCleanupPass() {
        TransactionStatus tx = null;
        try {
            tx = transactionManager.getTransaction(definition);

            if (!policyRepository.isInstalled()) {
                // Uninstalled while the worker kept running
                transactionManager.commit(tx);
                log.debug("TTL policy table not installed, nothing to clean up");
                return CleanupResult.skipped();
            }

            long deleted = expirationRoutine.run();
            transactionManager.commit(tx);
            return CleanupResult.completed(deleted);

        } catch (RuntimeException e) {
            abortQuietly(tx);
            return CleanupResult.failed(e);
        }
    }

    /**
     * Roll back whatever is left of the pass. Failures here are logged and dropped,
     * the original error is what gets reported.
     */
    private void abortQuietly(TransactionStatus tx) {
        if (tx == null || tx.isCompleted()) {
            return;
        }
        try {
            transactionManager.rollback(tx);
        } catch (RuntimeException rollbackError) {
            log.debug("TTL cleanup: rollback after failed pass also failed: " + rollbackError.getMessage());
        }
    }
}
