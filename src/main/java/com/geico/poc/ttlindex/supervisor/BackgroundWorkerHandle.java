package com.geico.poc.ttlindex.supervisor;

import com.geico.poc.ttlindex.worker.SignalState;
import com.geico.poc.ttlindex.worker.WorkerLatch;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A registered worker. Signals are delivered through the handle: each sets a flag
 * and the worker's latch, nothing more.
 */
public class BackgroundWorkerHandle {

    public enum State {
        PENDING,
        RUNNING,
        STOPPED
    }

    private final long id;
    private final BackgroundWorker worker;
    private final SignalState signals = new SignalState();
    private final WorkerLatch latch = new WorkerLatch();
    private final CountDownLatch startupDecided = new CountDownLatch(1);

    private volatile State state = State.PENDING;
    private volatile boolean reportedStarted;
    private volatile int pid;
    private volatile int exitCode = -1;
    private volatile Thread thread;

    BackgroundWorkerHandle(long id, BackgroundWorker worker) {
        this.id = id;
        this.worker = worker;
    }

    public void requestTerminate() {
        signals.requestTerminate();
        latch.set();
    }

    public void requestReload() {
        signals.requestReload();
        latch.set();
    }

    public long getId() {
        return id;
    }

    public BackgroundWorker getWorker() {
        return worker;
    }

    public State getState() {
        return state;
    }

    public boolean isAlive() {
        return state != State.STOPPED;
    }

    /**
     * Backend pid reported at startup, 0 before that
     */
    public int getPid() {
        return pid;
    }

    /**
     * Exit code of the last run, -1 while running
     */
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Whether the worker ever confirmed startup
     */
    public boolean hasReportedStarted() {
        return reportedStarted;
    }

    SignalState signals() {
        return signals;
    }

    WorkerLatch latch() {
        return latch;
    }

    void attachThread(Thread thread) {
        this.thread = thread;
    }

    Thread thread() {
        return thread;
    }

    void markStarted(int pid) {
        this.pid = pid;
        this.exitCode = -1;
        this.state = State.RUNNING;
        this.reportedStarted = true;
        startupDecided.countDown();
    }

    void markStopped(int exitCode) {
        this.exitCode = exitCode;
        this.state = State.STOPPED;
        startupDecided.countDown();
    }

    void markRestarting() {
        this.pid = 0;
        this.state = State.PENDING;
    }

    boolean awaitStartupDecision(long timeout, TimeUnit unit) throws InterruptedException {
        return startupDecided.await(timeout, unit);
    }

    @Override
    public String toString() {
        return "BackgroundWorkerHandle{" + worker.getName() + ", state=" + state + ", pid=" + pid + "}";
    }
}
