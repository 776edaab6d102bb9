package com.geico.poc.ttlindex.lifecycle;

import java.time.Instant;

/**
 * A worker session as seen in pg_stat_activity.
 */
public class WorkerStatus {

    private int workerPid;
    private String applicationName;
    private String state;
    private Instant backendStart;
    private Instant stateChange;
    private Instant queryStart;
    private String databaseName;

    public int getWorkerPid() {
        return workerPid;
    }

    public void setWorkerPid(int workerPid) {
        this.workerPid = workerPid;
    }

    public String getApplicationName() {
        return applicationName;
    }

    public void setApplicationName(String applicationName) {
        this.applicationName = applicationName;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public Instant getBackendStart() {
        return backendStart;
    }

    public void setBackendStart(Instant backendStart) {
        this.backendStart = backendStart;
    }

    public Instant getStateChange() {
        return stateChange;
    }

    public void setStateChange(Instant stateChange) {
        this.stateChange = stateChange;
    }

    public Instant getQueryStart() {
        return queryStart;
    }

    public void setQueryStart(Instant queryStart) {
        this.queryStart = queryStart;
    }

    public String getDatabaseName() {
        return databaseName;
    }

    public void setDatabaseName(String databaseName) {
        this.databaseName = databaseName;
    }
}
