package com.geico.poc.ttlindex.supervisor;

/**
 * Main routine of a kind of background worker, looked up by library and function name
 * when a {@link BackgroundWorker} is registered.
 */
public interface WorkerEntryPoint {

    String getLibraryName();

    String getFunctionName();

    /**
     * Runs on the worker's own thread. Must call {@link WorkerContext#reportStarted(int)}
     * once initialised, and return only when the worker is done.
     *
     * @return exit code, 0 for a clean exit
     */
    int main(WorkerContext context);
}
