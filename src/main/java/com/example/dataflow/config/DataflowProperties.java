package com.example.dataflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the {@code dataflow} prefix.
 */
@ConfigurationProperties(prefix = "dataflow")
public class DataflowProperties {

    private final Scheduler scheduler = new Scheduler();
    private final Fetch fetch = new Fetch();
    private final Metadata metadata = new Metadata();

    public Scheduler getScheduler() { return scheduler; }
    public Fetch getFetch() { return fetch; }
    public Metadata getMetadata() { return metadata; }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration reconcileInterval = Duration.ofSeconds(30);
        private Duration initialDelay = Duration.ZERO;
        // How often stop() logs while in-flight cycles drain
        private Duration shutdownLogInterval = Duration.ofSeconds(10);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getReconcileInterval() { return reconcileInterval; }
        public void setReconcileInterval(Duration reconcileInterval) { this.reconcileInterval = reconcileInterval; }
        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
        public Duration getShutdownLogInterval() { return shutdownLogInterval; }
        public void setShutdownLogInterval(Duration shutdownLogInterval) { this.shutdownLogInterval = shutdownLogInterval; }
    }

    public static class Fetch {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(60);
        private int maxErrorBodyBytes = 2048;

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
        public int getMaxErrorBodyBytes() { return maxErrorBodyBytes; }
        public void setMaxErrorBodyBytes(int maxErrorBodyBytes) { this.maxErrorBodyBytes = maxErrorBodyBytes; }
    }

    public static class Metadata {
        private String schema = "public";
        private String periodicTableType = "time_series";
        private int logLimit = 100;

        public String getSchema() { return schema; }
        public void setSchema(String schema) { this.schema = schema; }
        public String getPeriodicTableType() { return periodicTableType; }
        public void setPeriodicTableType(String periodicTableType) { this.periodicTableType = periodicTableType; }
        public int getLogLimit() { return logLimit; }
        public void setLogLimit(int logLimit) { this.logLimit = logLimit; }
    }
}
