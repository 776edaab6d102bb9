package com.geico.poc.ttlindex.policy;

import java.time.Instant;
import java.util.Objects;

/**
 * One row of the policy table: rows of {@code tableName} whose {@code columnName}
 * is older than {@code expireAfterSeconds} are expired.
 */
public class TtlPolicy {

    private String tableName;
    private String columnName;
    private int expireAfterSeconds;
    private int batchSize;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;

    // Run statistics, maintained by the expiration routine
    private Instant lastRun;
    private Long secondsSinceLastRun;
    private long rowsDeletedLastRun;
    private long totalRowsDeleted;

    private String indexName;

    public TtlPolicy() {
    }

    public TtlPolicy(String tableName, String columnName, int expireAfterSeconds, int batchSize) {
        this.tableName = tableName;
        this.columnName = columnName;
        this.expireAfterSeconds = expireAfterSeconds;
        this.batchSize = batchSize;
        this.active = true;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getColumnName() {
        return columnName;
    }

    public void setColumnName(String columnName) {
        this.columnName = columnName;
    }

    public int getExpireAfterSeconds() {
        return expireAfterSeconds;
    }

    public void setExpireAfterSeconds(int expireAfterSeconds) {
        this.expireAfterSeconds = expireAfterSeconds;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getLastRun() {
        return lastRun;
    }

    public void setLastRun(Instant lastRun) {
        this.lastRun = lastRun;
    }

    /**
     * Seconds between the last run and the time the policy was read, or null if it never ran.
     */
    public Long getSecondsSinceLastRun() {
        return secondsSinceLastRun;
    }

    public void setSecondsSinceLastRun(Long secondsSinceLastRun) {
        this.secondsSinceLastRun = secondsSinceLastRun;
    }

    public long getRowsDeletedLastRun() {
        return rowsDeletedLastRun;
    }

    public void setRowsDeletedLastRun(long rowsDeletedLastRun) {
        this.rowsDeletedLastRun = rowsDeletedLastRun;
    }

    public long getTotalRowsDeleted() {
        return totalRowsDeleted;
    }

    public void setTotalRowsDeleted(long totalRowsDeleted) {
        this.totalRowsDeleted = totalRowsDeleted;
    }

    public String getIndexName() {
        return indexName;
    }

    public void setIndexName(String indexName) {
        this.indexName = indexName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TtlPolicy that = (TtlPolicy) o;
        return Objects.equals(tableName, that.tableName) && Objects.equals(columnName, that.columnName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableName, columnName);
    }

    @Override
    public String toString() {
        return "TtlPolicy{" + tableName + "." + columnName +
               ", expireAfterSeconds=" + expireAfterSeconds +
               ", batchSize=" + batchSize +
               ", active=" + active + "}";
    }
}
