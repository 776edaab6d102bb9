package com.geico.poc.ttlindex.worker;

import com.geico.poc.ttlindex.config.TtlIndexConfig;

/**
 * Settings a running worker re-reads on reload.
 */
public class WorkerSettings {

    private int naptime = TtlIndexConfig.DEFAULT_NAPTIME_SECONDS;
    private boolean enabled = true;

    public WorkerSettings() {
    }

    public WorkerSettings(int naptime, boolean enabled) {
        this.naptime = naptime;
        this.enabled = enabled;
    }

    public int getNaptime() {
        return naptime;
    }

    public void setNaptime(int naptime) {
        this.naptime = naptime;
    }

    public long getNaptimeMillis() {
        return naptime * 1000L;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public String toString() {
        return "naptime=" + naptime + "s, enabled=" + enabled;
    }
}
