package com.geico.poc.ttlindex.dto;

/**
 * Runtime override of the worker's reloadable settings. Null fields are left unchanged.
 */
public class WorkerSettingsRequest {
    private Integer naptime;
    private Boolean enabled;

    public Integer getNaptime() {
        return naptime;
    }

    public void setNaptime(Integer naptime) {
        this.naptime = naptime;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    public void setEnabled(Boolean enabled) {
        this.enabled = enabled;
    }
}
