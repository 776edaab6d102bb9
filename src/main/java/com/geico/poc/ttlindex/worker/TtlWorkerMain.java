package com.geico.poc.ttlindex.worker;

import com.geico.poc.ttlindex.lifecycle.RecoveryStateProbe;
import com.geico.poc.ttlindex.policy.TtlPolicyRepository;
import com.geico.poc.ttlindex.supervisor.WorkerContext;
import com.geico.poc.ttlindex.supervisor.WorkerEntryPoint;
import com.geico.poc.ttlindex.supervisor.WorkerStartupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Entry point of the TTL background worker. The main argument is the oid of the
 * database the worker serves.
 */
@Component
public class TtlWorkerMain implements WorkerEntryPoint {

    private static final Logger log = LoggerFactory.getLogger(TtlWorkerMain.class);

    public static final String LIBRARY_NAME = "pg_ttl_index";
    public static final String FUNCTION_NAME = "ttl_worker_main";
    public static final String WORKER_TYPE = "TTL Index Worker";

    @Autowired
    private WorkerSessionFactory sessionFactory;

    @Autowired
    private WorkerSettingsProvider settingsProvider;

    @Override
    public String getLibraryName() {
        return LIBRARY_NAME;
    }

    @Override
    public String getFunctionName() {
        return FUNCTION_NAME;
    }

    @Override
    public int main(WorkerContext context) {
        long databaseOid = context.getMainArg();
        if (databaseOid <= 0) {
            throw new WorkerStartupException("TTL background worker: invalid database OID " + databaseOid);
        }

        try (WorkerSession session = sessionFactory.open(databaseOid, context.getName())) {
            log.info("🔌 " + context.getName() + " connected (backend pid " + session.getBackendPid() + ")");
            context.reportStarted(session.getBackendPid());

            TtlPolicyRepository policyRepository = new TtlPolicyRepository(session.getJdbcTemplate());
            CleanupExecutor cleanupExecutor = new CleanupExecutor(
                session.getTransactionManager(),
                policyRepository,
                new ExpirationRoutine(session.getJdbcTemplate(), policyRepository));

            TtlWorker worker = new TtlWorker(
                context.getName(),
                context.getSignals(),
                context.getLatch(),
                settingsProvider,
                new RecoveryStateProbe(session.getJdbcTemplate()),
                cleanupExecutor);
            return worker.run();
        }
    }
}
