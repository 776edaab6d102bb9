package com.geico.poc.ttlindex.supervisor;

import com.geico.poc.ttlindex.config.TtlIndexConfig;
import com.geico.poc.ttlindex.lifecycle.RecoveryStateProbe;
import com.geico.poc.ttlindex.worker.WorkerLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Supervisor for background workers.
 *
 * Each registered worker runs its entry point on a dedicated daemon thread.
 * Callers register a {@link BackgroundWorker} descriptor, then block in
 * {@link #waitForStartup} until the worker reports it is up, ends, or the
 * supervisor itself shuts down.
 *
 * On shutdown every worker is asked to terminate; workers that do not exit in time
 * see supervisor death on their latch and are interrupted.
 */
@Component
public class WorkerSupervisor {

    private static final Logger log = LoggerFactory.getLogger(WorkerSupervisor.class);

    static final long STARTUP_POLL_MILLIS = 100;
    static final long RECOVERY_RECHECK_MILLIS = 1000;
    static final long RESTART_DELAY_MILLIS = 1000;
    static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final TtlIndexConfig config;
    private final RecoveryStateProbe recoveryProbe;
    private final Map<String, WorkerEntryPoint> entryPoints = new HashMap<>();
    private final Map<Long, BackgroundWorkerHandle> handles = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final AtomicBoolean running = new AtomicBoolean(true);

    @Autowired
    public WorkerSupervisor(TtlIndexConfig config,
                            List<WorkerEntryPoint> entryPoints,
                            RecoveryStateProbe recoveryProbe) {
        this.config = config;
        this.recoveryProbe = recoveryProbe;
        for (WorkerEntryPoint entryPoint : entryPoints) {
            this.entryPoints.put(entryPoint.getLibraryName() + "." + entryPoint.getFunctionName(), entryPoint);
        }
    }

    /**
     * Register and launch a worker.
     *
     * @return the handle, or empty if the supervisor is shut down or out of worker slots
     * @throws IllegalArgumentException if no entry point matches the descriptor
     */
    public synchronized Optional<BackgroundWorkerHandle> register(BackgroundWorker worker) {
        WorkerEntryPoint entryPoint = entryPoints.get(worker.entryPointKey());
        if (entryPoint == null) {
            throw new IllegalArgumentException("No worker entry point " + worker.entryPointKey());
        }
        if (!running.get()) {
            log.warn("⚠️  Cannot register " + worker.getName() + ": supervisor is shut down");
            return Optional.empty();
        }
        if (getLiveWorkerCount() >= config.getMaxWorkerProcesses()) {
            log.warn("⚠️  Cannot register " + worker.getName() + ": max-worker-processes (" +
                     config.getMaxWorkerProcesses() + ") reached");
            return Optional.empty();
        }

        BackgroundWorkerHandle handle = new BackgroundWorkerHandle(nextId.getAndIncrement(), worker);
        handles.put(handle.getId(), handle);

        Thread t = new Thread(() -> runWorker(handle, entryPoint));
        t.setName("bgworker-" + handle.getId() + "-" + worker.getName());
        t.setDaemon(true);
        handle.attachThread(t);

        log.info("📋 Registered background worker: " + worker);
        t.start();
        return Optional.of(handle);
    }

    /**
     * Block until the worker reports startup, ends, or the supervisor shuts down.
     */
    public StartupStatus waitForStartup(BackgroundWorkerHandle handle) {
        try {
            while (true) {
                if (handle.awaitStartupDecision(STARTUP_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return handle.hasReportedStarted() ? StartupStatus.STARTED : StartupStatus.STOPPED;
                }
                if (!running.get()) {
                    return StartupStatus.SUPERVISOR_DIED;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerStartupException("Interrupted while waiting for " + handle.getWorker().getName(), e);
        }
    }

    /**
     * Deliver a terminate request to the local worker whose session has the given backend pid.
     *
     * @return true if such a worker is registered here
     */
    public boolean signalTerminate(int pid) {
        boolean found = false;
        for (BackgroundWorkerHandle handle : handles.values()) {
            if (handle.isAlive() && handle.getPid() == pid) {
                handle.requestTerminate();
                found = true;
            }
        }
        return found;
    }

    /**
     * @return number of workers signalled
     */
    public int signalReloadAll() {
        int signalled = 0;
        for (BackgroundWorkerHandle handle : handles.values()) {
            if (handle.isAlive()) {
                handle.requestReload();
                signalled++;
            }
        }
        return signalled;
    }

    public List<BackgroundWorkerHandle> getHandles() {
        return new ArrayList<>(handles.values());
    }

    public int getLiveWorkerCount() {
        int live = 0;
        for (BackgroundWorkerHandle handle : handles.values()) {
            if (handle.isAlive()) {
                live++;
            }
        }
        return live;
    }

    public boolean isRunning() {
        return running.get();
    }

    private void runWorker(BackgroundWorkerHandle handle, WorkerEntryPoint entryPoint) {
        BackgroundWorker worker = handle.getWorker();
        try {
            while (true) {
                int exitCode;
                if (!awaitStartCondition(handle)) {
                    handle.markStopped(1);
                    return;
                }

                try {
                    exitCode = entryPoint.main(new WorkerContext(handle));
                } catch (RuntimeException e) {
                    log.error("❌ Background worker " + worker.getName() + " failed: " + e.getMessage(), e);
                    exitCode = 1;
                }
                log.info("Background worker \"" + worker.getName() + "\" exited with exit code " + exitCode);

                if (shouldRestart(handle, exitCode)) {
                    handle.markRestarting();
                    log.info("🔄 Restarting background worker " + worker.getName());
                    continue;
                }
                handle.markStopped(exitCode);
                return;
            }
        } finally {
            handles.remove(handle.getId());
        }
    }

    private boolean awaitStartCondition(BackgroundWorkerHandle handle) {
        if (handle.getWorker().getStartCondition() != StartCondition.RECOVERY_FINISHED || recoveryProbe == null) {
            return true;
        }
        WorkerLatch latch = handle.latch();
        while (running.get() && !handle.signals().isTerminateRequested()) {
            try {
                if (!recoveryProbe.isInRecovery()) {
                    return true;
                }
                log.debug(handle.getWorker().getName() + " waiting for recovery to finish");
            } catch (RuntimeException e) {
                log.warn("⚠️  Could not check recovery state for " + handle.getWorker().getName() + ": " + e.getMessage());
            }
            latch.reset();
            int rc = latch.await(RECOVERY_RECHECK_MILLIS);
            if ((rc & WorkerLatch.WL_SUPERVISOR_DEATH) != 0) {
                return false;
            }
        }
        return false;
    }

    private boolean shouldRestart(BackgroundWorkerHandle handle, int exitCode) {
        if (handle.getWorker().getRestartPolicy() != RestartPolicy.ON_FAILURE || exitCode == 0) {
            return false;
        }
        if (!running.get() || handle.signals().isTerminateRequested()) {
            return false;
        }
        WorkerLatch latch = handle.latch();
        latch.reset();
        int rc = latch.await(RESTART_DELAY_MILLIS);
        return (rc & WorkerLatch.WL_SUPERVISOR_DEATH) == 0
            && running.get()
            && !handle.signals().isTerminateRequested();
    }

    @PreDestroy
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        List<BackgroundWorkerHandle> live = getHandles();
        if (live.isEmpty()) {
            return;
        }

        log.info("🛑 Stopping " + live.size() + " background worker(s)...");
        for (BackgroundWorkerHandle handle : live) {
            handle.requestTerminate();
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(SHUTDOWN_TIMEOUT_SECONDS);
        for (BackgroundWorkerHandle handle : live) {
            Thread t = handle.thread();
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            try {
                if (t != null && remainingMillis > 0) {
                    t.join(remainingMillis);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        for (BackgroundWorkerHandle handle : live) {
            Thread t = handle.thread();
            if (t != null && t.isAlive()) {
                log.warn("⚠️  Background worker " + handle.getWorker().getName() + " did not stop in time");
                handle.latch().markSupervisorDead();
                t.interrupt();
            }
        }
        log.info("✅ Background workers stopped");
    }
}
