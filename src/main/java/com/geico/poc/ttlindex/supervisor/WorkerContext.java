package com.geico.poc.ttlindex.supervisor;

import com.geico.poc.ttlindex.worker.SignalState;
import com.geico.poc.ttlindex.worker.WorkerLatch;

/**
 * What an entry point sees of its own registration.
 */
public class WorkerContext {

    private final BackgroundWorkerHandle handle;

    WorkerContext(BackgroundWorkerHandle handle) {
        this.handle = handle;
    }

    public String getName() {
        return handle.getWorker().getName();
    }

    public long getMainArg() {
        return handle.getWorker().getMainArg();
    }

    public SignalState getSignals() {
        return handle.signals();
    }

    public WorkerLatch getLatch() {
        return handle.latch();
    }

    /**
     * Confirm startup to whoever is waiting in {@link WorkerSupervisor#waitForStartup}.
     *
     * @param pid backend pid of the worker's store session
     */
    public void reportStarted(int pid) {
        handle.markStarted(pid);
    }
}
