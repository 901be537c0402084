package net.cloudjob.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("cloudjob")
public class CloudJobProperties {
    private String zone = "UTC";
    private Store store = new Store();
    private Scheduler scheduler = new Scheduler();
    private Catalog catalog = new Catalog();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Store {
        /** jdbc(임베디드 SQLite) | rest(호스티드 PostgREST) */
        private String type = "jdbc";
        private Rest rest = new Rest();

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public Rest getRest() {
            return rest;
        }

        public void setRest(Rest rest) {
            this.rest = rest;
        }
    }

    public static class Rest {
        private String url;
        private String apiKey;
        private String table = "cloud_jobs";
        private Duration timeout = Duration.ofSeconds(10);

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private String instancePrefix = "cloudjob";
        private Duration lease = Duration.ofMinutes(30);
        private Duration executorInterval = Duration.ofSeconds(30);
        private Duration creatorInterval = Duration.ofSeconds(60);
        private Duration reaperInterval = Duration.ofSeconds(300);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private Duration firstRunGrace = Duration.ofMinutes(5);
        private Duration retryBackoff = Duration.ZERO;       // 0 = 즉시 재시도
        private Duration retryBackoffMax = Duration.ofMinutes(10);
        private int candidateBatch = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getInstancePrefix() {
            return instancePrefix;
        }

        public void setInstancePrefix(String instancePrefix) {
            this.instancePrefix = instancePrefix;
        }

        public Duration getLease() {
            return lease;
        }

        public void setLease(Duration lease) {
            this.lease = lease;
        }

        public Duration getExecutorInterval() {
            return executorInterval;
        }

        public void setExecutorInterval(Duration executorInterval) {
            this.executorInterval = executorInterval;
        }

        public Duration getCreatorInterval() {
            return creatorInterval;
        }

        public void setCreatorInterval(Duration creatorInterval) {
            this.creatorInterval = creatorInterval;
        }

        public Duration getReaperInterval() {
            return reaperInterval;
        }

        public void setReaperInterval(Duration reaperInterval) {
            this.reaperInterval = reaperInterval;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public Duration getFirstRunGrace() {
            return firstRunGrace;
        }

        public void setFirstRunGrace(Duration firstRunGrace) {
            this.firstRunGrace = firstRunGrace;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public Duration getRetryBackoffMax() {
            return retryBackoffMax;
        }

        public void setRetryBackoffMax(Duration retryBackoffMax) {
            this.retryBackoffMax = retryBackoffMax;
        }

        public int getCandidateBatch() {
            return candidateBatch;
        }

        public void setCandidateBatch(int candidateBatch) {
            this.candidateBatch = candidateBatch;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<JobDef> jobs = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<JobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<JobDef> jobs) {
            this.jobs = jobs;
        }
    }

    public static class JobDef {
        private String name;
        private String description;
        private String jobType;
        private String cronExpression;
        private Map<String, Object> config = new LinkedHashMap<>(); // ← 가변
        private int maxRetries = 3;
        private boolean enabled = true;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getJobType() {
            return jobType;
        }

        public void setJobType(String jobType) {
            this.jobType = jobType;
        }

        public String getCronExpression() {
            return cronExpression;
        }

        public void setCronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
        }

        public Map<String, Object> getConfig() {
            return config;
        }

        public void setConfig(Map<String, Object> config) {
            this.config = config;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", jobType='" + jobType + '\'' +
                    ", cronExpression='" + cronExpression + '\'' +
                    ", maxRetries=" + maxRetries +
                    ", enabled=" + enabled +
                    '}';
        }
    }
}
