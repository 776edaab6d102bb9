package com.geico.poc.ttlindex.worker;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;

/**
 * Wait primitive of a background worker.
 *
 * {@link #set()} may be called from any thread: it is one atomic store and an unpark,
 * it never blocks and never allocates. Only the owning worker thread waits.
 *
 * A set that happens between {@link #reset()} and {@link #await(long)} is not lost:
 * the wait returns immediately.
 */
public class WorkerLatch {

    public static final int WL_LATCH_SET = 1;
    public static final int WL_TIMEOUT = 1 << 1;
    public static final int WL_SUPERVISOR_DEATH = 1 << 2;

    private final AtomicBoolean latchSet = new AtomicBoolean(false);
    private volatile boolean supervisorDead;
    private volatile Thread waiter;

    public void set() {
        latchSet.set(true);
        Thread t = waiter;
        if (t != null) {
            LockSupport.unpark(t);
        }
    }

    public void reset() {
        latchSet.set(false);
    }

    public boolean isSet() {
        return latchSet.get();
    }

    /**
     * Wakes the waiter permanently with {@link #WL_SUPERVISOR_DEATH}.
     */
    public void markSupervisorDead() {
        supervisorDead = true;
        Thread t = waiter;
        if (t != null) {
            LockSupport.unpark(t);
        }
    }

    /**
     * Block until the latch is set, the supervisor dies, or the timeout elapses.
     * An interrupt of the waiting thread counts as supervisor death.
     *
     * @return bit set of WL_* flags describing why the wait ended
     */
    public int await(long timeoutMillis) {
        waiter = Thread.currentThread();
        try {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
            while (true) {
                int result = 0;
                if (latchSet.get()) {
                    result |= WL_LATCH_SET;
                }
                if (supervisorDead) {
                    result |= WL_SUPERVISOR_DEATH;
                }
                if (result != 0) {
                    return result;
                }

                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return WL_TIMEOUT;
                }
                LockSupport.parkNanos(this, remaining);

                if (Thread.interrupted()) {
                    supervisorDead = true;
                }
            }
        } finally {
            waiter = null;
        }
    }
}
