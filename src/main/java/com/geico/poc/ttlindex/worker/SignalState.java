package com.geico.poc.ttlindex.worker;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Terminate and reload requests for one worker. Set asynchronously by whoever signals
 * the worker, consumed by the worker's own loop.
 */
public class SignalState {

    private final AtomicBoolean terminateRequested = new AtomicBoolean(false);
    private final AtomicBoolean reloadRequested = new AtomicBoolean(false);

    public void requestTerminate() {
        terminateRequested.set(true);
    }

    public void requestReload() {
        reloadRequested.set(true);
    }

    public boolean isTerminateRequested() {
        return terminateRequested.get();
    }

    /**
     * @return true if a reload was pending; the request is cleared
     */
    public boolean consumeReload() {
        return reloadRequested.getAndSet(false);
    }
}
