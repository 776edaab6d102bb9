package com.geico.poc.ttlindex.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the TTL index application.
 *
 * Only {@code naptime} and {@code enabled} are re-read by a running worker on reload
 * (see {@link com.geico.poc.ttlindex.worker.EnvironmentWorkerSettingsProvider}).
 * Everything else is fixed at startup.
 */
@Configuration
@ConfigurationProperties(prefix = "pg-ttl-index")
public class TtlIndexConfig {

    public static final int DEFAULT_NAPTIME_SECONDS = 60;
    public static final int NAPTIME_MIN_SECONDS = 1;
    public static final int DEFAULT_BATCH_SIZE = 10000;

    /**
     * Seconds between scheduled cleanup passes
     */
    private int naptime = DEFAULT_NAPTIME_SECONDS;

    /**
     * Whether a running worker performs cleanup passes at all
     */
    private boolean enabled = true;

    private int defaultBatchSize = DEFAULT_BATCH_SIZE;

    /**
     * Upper bound on live background workers in this JVM
     */
    private int maxWorkerProcesses = 8;

    private boolean createSupportingIndex = true;

    /**
     * Create the policy table when the application starts
     */
    private boolean autoInstall = true;

    /**
     * Start the worker for the configured database when the application starts
     */
    private boolean autoStart = false;

    public int getNaptime() {
        return naptime;
    }

    public void setNaptime(int naptime) {
        this.naptime = naptime;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getDefaultBatchSize() {
        return defaultBatchSize;
    }

    public void setDefaultBatchSize(int defaultBatchSize) {
        this.defaultBatchSize = defaultBatchSize;
    }

    public int getMaxWorkerProcesses() {
        return maxWorkerProcesses;
    }

    public void setMaxWorkerProcesses(int maxWorkerProcesses) {
        this.maxWorkerProcesses = maxWorkerProcesses;
    }

    public boolean isCreateSupportingIndex() {
        return createSupportingIndex;
    }

    public void setCreateSupportingIndex(boolean createSupportingIndex) {
        this.createSupportingIndex = createSupportingIndex;
    }

    public boolean isAutoInstall() {
        return autoInstall;
    }

    public void setAutoInstall(boolean autoInstall) {
        this.autoInstall = autoInstall;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }
}
