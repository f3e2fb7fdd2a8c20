package com.example.dataflow.core.model;

import java.time.Instant;

/**
 * One row of {@code table_metadata}: a registered table, how it is refreshed and how
 * the last refresh went.
 */
public class TableMetadata {

    private String tableName;
    private String tableType;
    private Integer refreshInterval; // seconds, null for tables that are never refreshed
    private String dataSourceUrl;
    private RefreshStatus status;
    private Instant lastRefreshSuccess;
    private String lastRefreshError;

    // --- Getters and Setters ---
    public String getTableName() { return tableName; }
    public void setTableName(String tableName) { this.tableName = tableName; }
    public String getTableType() { return tableType; }
    public void setTableType(String tableType) { this.tableType = tableType; }
    public Integer getRefreshInterval() { return refreshInterval; }
    public void setRefreshInterval(Integer refreshInterval) { this.refreshInterval = refreshInterval; }
    public String getDataSourceUrl() { return dataSourceUrl; }
    public void setDataSourceUrl(String dataSourceUrl) { this.dataSourceUrl = dataSourceUrl; }
    public RefreshStatus getStatus() { return status; }
    public void setStatus(RefreshStatus status) { this.status = status; }
    public Instant getLastRefreshSuccess() { return lastRefreshSuccess; }
    public void setLastRefreshSuccess(Instant lastRefreshSuccess) { this.lastRefreshSuccess = lastRefreshSuccess; }
    public String getLastRefreshError() { return lastRefreshError; }
    public void setLastRefreshError(String lastRefreshError) { this.lastRefreshError = lastRefreshError; }

    /**
     * A table is refreshed periodically only when it carries the periodic type tag and
     * has both a positive interval and a non-blank source URL.
     *
     * @param periodicTableType The type tag that marks periodic tables (e.g. "time_series").
     * @return true if the scheduler should track this table.
     */
    public boolean isRefreshable(String periodicTableType) {
        return periodicTableType.equals(tableType)
               && refreshInterval != null && refreshInterval > 0
               && dataSourceUrl != null && !dataSourceUrl.isBlank();
    }

    public JobSpec toJobSpec() {
        return new JobSpec(tableName, refreshInterval, dataSourceUrl);
    }

    @Override
    public String toString() {
        return "TableMetadata{" +
               "tableName='" + tableName + '\'' +
               ", tableType='" + tableType + '\'' +
               ", refreshInterval=" + refreshInterval +
               ", status=" + status +
               '}';
    }
}
