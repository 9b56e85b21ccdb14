package com.cronq.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "cronq")
public class CronQProperties {

    private final Database database = new Database();
    private final Reconciliation reconciliation = new Reconciliation();
    private final Resolver resolver = new Resolver();
    private final Timers timers = new Timers();
    private final Execution execution = new Execution();
    private final Identity identity = new Identity();
    private final Events events = new Events();
    private final Cleanup cleanup = new Cleanup();

    public Database getDatabase() {
        return database;
    }

    public Reconciliation getReconciliation() {
        return reconciliation;
    }

    public Resolver getResolver() {
        return resolver;
    }

    public Timers getTimers() {
        return timers;
    }

    public Execution getExecution() {
        return execution;
    }

    public Identity getIdentity() {
        return identity;
    }

    public Events getEvents() {
        return events;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    public static class Database {
        private String tablePrefix = "";
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }

        public boolean isSkipCreate() {
            return skipCreate;
        }

        public void setSkipCreate(boolean skipCreate) {
            this.skipCreate = skipCreate;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    public static class Reconciliation {
        private boolean enabled = true;
        private long pollIntervalInSeconds = 300;
        // Jobs due within the horizon are armed in memory; later ones stay pending.
        private Duration horizon = Duration.ofMinutes(5);
        private Duration graceWindow = Duration.ofMinutes(1);
        private int batchSize = 500;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPollIntervalInSeconds() {
            return pollIntervalInSeconds;
        }

        public void setPollIntervalInSeconds(long pollIntervalInSeconds) {
            this.pollIntervalInSeconds = pollIntervalInSeconds;
        }

        public Duration getHorizon() {
            return horizon;
        }

        public void setHorizon(Duration horizon) {
            this.horizon = horizon;
        }

        public Duration getGraceWindow() {
            return graceWindow;
        }

        public void setGraceWindow(Duration graceWindow) {
            this.graceWindow = graceWindow;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Resolver {
        private int maxSearchYears = 4;

        public int getMaxSearchYears() {
            return maxSearchYears;
        }

        public void setMaxSearchYears(int maxSearchYears) {
            this.maxSearchYears = maxSearchYears;
        }
    }

    public static class Timers {
        private int poolSize = 2;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }

    public static class Execution {
        private int workerCount = Math.max(2, Runtime.getRuntime().availableProcessors());

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }
    }

    public static class Identity {
        private String clusterId = "default";
        private String serverId = "";

        public String getClusterId() {
            return clusterId;
        }

        public void setClusterId(String clusterId) {
            this.clusterId = clusterId;
        }

        public String getServerId() {
            return serverId;
        }

        public void setServerId(String serverId) {
            this.serverId = serverId;
        }
    }

    public static class Events {
        private String collection = "cron-job";

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }
    }

    public static class Cleanup {
        private String deleteInactiveJobsAfter = "";

        public String getDeleteInactiveJobsAfter() {
            return deleteInactiveJobsAfter;
        }

        public void setDeleteInactiveJobsAfter(String deleteInactiveJobsAfter) {
            this.deleteInactiveJobsAfter = deleteInactiveJobsAfter;
        }
    }
}
