package com.geico.poc.ttlindex.dto;

public class TtlIndexRequest {
    private String tableName;
    private String columnName;
    private int expireAfterSeconds;
    private Integer batchSize;

    public TtlIndexRequest() {
    }

    public TtlIndexRequest(String tableName, String columnName, int expireAfterSeconds, Integer batchSize) {
        this.tableName = tableName;
        this.columnName = columnName;
        this.expireAfterSeconds = expireAfterSeconds;
        this.batchSize = batchSize;
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

    public Integer getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(Integer batchSize) {
        this.batchSize = batchSize;
    }
}
