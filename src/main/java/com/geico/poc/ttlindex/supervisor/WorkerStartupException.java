package com.geico.poc.ttlindex.supervisor;

/**
 * Fatal lifecycle error: the worker (or the call starting it) cannot continue.
 */
public class WorkerStartupException extends RuntimeException {

    public WorkerStartupException(String message) {
        super(message);
    }

    public WorkerStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
