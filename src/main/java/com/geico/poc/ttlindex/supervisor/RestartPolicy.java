package com.geico.poc.ttlindex.supervisor;

public enum RestartPolicy {
    /** A worker that exits stays gone */
    NEVER,
    /** Relaunch after a non-zero exit, unless terminate was requested */
    ON_FAILURE
}
