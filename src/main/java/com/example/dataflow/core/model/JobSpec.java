package com.example.dataflow.core.model;

import java.util.Objects;

/**
 * Desired periodic refresh for one table, derived from eligible table metadata.
 * Two specs are equal when table, interval and URL are all equal.
 */
public final class JobSpec {

    private final String tableName;
    private final int intervalSeconds;
    private final String sourceUrl;

    public JobSpec(String tableName, int intervalSeconds, String sourceUrl) {
        this.tableName = Objects.requireNonNull(tableName, "tableName cannot be null");
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("Refresh interval must be positive for table " + tableName + ": " + intervalSeconds);
        }
        this.intervalSeconds = intervalSeconds;
        this.sourceUrl = sourceUrl;
    }

    public String getTableName() {
        return tableName;
    }

    public int getIntervalSeconds() {
        return intervalSeconds;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobSpec that = (JobSpec) o;
        return intervalSeconds == that.intervalSeconds
               && tableName.equals(that.tableName)
               && Objects.equals(sourceUrl, that.sourceUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableName, intervalSeconds, sourceUrl);
    }

    @Override
    public String toString() {
        return "JobSpec{" +
               "tableName='" + tableName + '\'' +
               ", intervalSeconds=" + intervalSeconds +
               ", sourceUrl='" + sourceUrl + '\'' +
               '}';
    }
}
