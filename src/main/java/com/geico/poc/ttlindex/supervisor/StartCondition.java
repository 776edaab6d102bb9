package com.geico.poc.ttlindex.supervisor;

public enum StartCondition {
    IMMEDIATE,
    /** Hold the launch until the store has left recovery */
    RECOVERY_FINISHED
}
