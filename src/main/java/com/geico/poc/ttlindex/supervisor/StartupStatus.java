package com.geico.poc.ttlindex.supervisor;

/**
 * Result of waiting for a registered worker to start.
 */
public enum StartupStatus {
    /** The worker reported its session is up */
    STARTED,
    /** The worker ended before reporting startup */
    STOPPED,
    /** The supervisor shut down while the caller was waiting */
    SUPERVISOR_DIED
}
