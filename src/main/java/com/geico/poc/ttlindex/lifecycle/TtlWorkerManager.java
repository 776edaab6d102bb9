package com.geico.poc.ttlindex.lifecycle;

import com.geico.poc.ttlindex.supervisor.BackgroundWorker;
import com.geico.poc.ttlindex.supervisor.BackgroundWorkerHandle;
import com.geico.poc.ttlindex.supervisor.RestartPolicy;
import com.geico.poc.ttlindex.supervisor.StartCondition;
import com.geico.poc.ttlindex.supervisor.StartupStatus;
import com.geico.poc.ttlindex.supervisor.WorkerStartupException;
import com.geico.poc.ttlindex.supervisor.WorkerSupervisor;
import com.geico.poc.ttlindex.worker.TtlWorkerMain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Starts and stops the TTL worker of the current database.
 *
 * At most one worker per database: start is a no-op returning true when one is
 * already live anywhere (per pg_stat_activity), and the check-and-register runs
 * under {@link WorkerStartGuard}.
 */
@Component
public class TtlWorkerManager {

    private static final Logger log = LoggerFactory.getLogger(TtlWorkerManager.class);

    @Autowired
    private RecoveryStateProbe recoveryProbe;

    @Autowired
    private WorkerRegistryProbe registryProbe;

    @Autowired
    private WorkerStartGuard startGuard;

    @Autowired
    private WorkerSupervisor supervisor;

    /**
     * Start the worker for the current database.
     *
     * @return true if a worker is running (already, or newly started); false if it could
     *         not be registered or stopped before confirming startup
     * @throws RecoveryInProgressException if the store is in recovery
     * @throws WorkerStartupException if the supervisor shut down during start-up
     */
    public boolean start() {
        if (recoveryProbe.isInRecovery()) {
            throw new RecoveryInProgressException("cannot start TTL worker during recovery");
        }
        return startGuard.runExclusively(this::startExclusively);
    }

    private boolean startExclusively() {
        if (registryProbe.isWorkerRunning()) {
            log.info("TTL worker already running for this database");
            return true;
        }

        BackgroundWorker worker = describeWorker(registryProbe.currentDatabaseOid());
        Optional<BackgroundWorkerHandle> handle = supervisor.register(worker);
        if (handle.isEmpty()) {
            return false;
        }

        StartupStatus status = supervisor.waitForStartup(handle.get());
        switch (status) {
            case STARTED:
                log.info("✅ " + worker.getName() + " started (pid " + handle.get().getPid() + ")");
                return true;
            case STOPPED:
                log.warn("⚠️  " + worker.getName() + " stopped before confirming startup");
                return false;
            case SUPERVISOR_DIED:
                throw new WorkerStartupException("supervisor died while starting TTL background worker");
            default:
                throw new WorkerStartupException("unknown background worker startup result: " + status);
        }
    }

    /**
     * Request termination of every worker session of the current database.
     * Does not wait for them to exit.
     *
     * Workers owned by this application only get the terminate flag, so a pass in flight
     * still commits. Backends of workers owned elsewhere are terminated through the store.
     *
     * @return true iff at least one termination request was delivered
     */
    public boolean stop() {
        List<Integer> pids = registryProbe.findWorkerPids();
        if (pids.isEmpty()) {
            log.info("No TTL worker running for this database");
            return false;
        }

        int requested = 0;
        for (Integer pid : pids) {
            if (supervisor.signalTerminate(pid)) {
                log.info("🛑 Requested termination of local TTL worker pid " + pid);
                requested++;
            } else if (registryProbe.terminateBackend(pid)) {
                log.info("🛑 Terminated backend of TTL worker pid " + pid);
                requested++;
            } else {
                log.warn("⚠️  Could not terminate TTL worker pid " + pid);
            }
        }
        return requested > 0;
    }

    /**
     * Deliver a reload request to every worker of this application.
     *
     * @return number of workers signalled
     */
    public int reload() {
        int signalled = supervisor.signalReloadAll();
        log.info("🔄 Reload requested for " + signalled + " TTL worker(s)");
        return signalled;
    }

    public List<WorkerStatus> status() {
        return registryProbe.listWorkers();
    }

    static BackgroundWorker describeWorker(long databaseOid) {
        return new BackgroundWorker(
            WorkerRegistryProbe.workerName(databaseOid),
            TtlWorkerMain.WORKER_TYPE,
            TtlWorkerMain.LIBRARY_NAME,
            TtlWorkerMain.FUNCTION_NAME,
            databaseOid,
            RestartPolicy.NEVER,
            StartCondition.RECOVERY_FINISHED);
    }
}
