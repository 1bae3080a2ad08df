package com.pulsarr.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Spring Boot configuration properties for the content router.
 */
@ConfigurationProperties(prefix = "pulsarr")
public class RouterProperties {

    /**
     * Whether the content router is enabled.
     */
    private boolean enabled = true;

    /**
     * Optional seed file with users, instances, quotas and rules.
     * Supports classpath: prefix for classpath resources.
     */
    private String seedPath;

    private final Router router = new Router();
    private final Lookup lookup = new Lookup();
    private final Approval approval = new Approval();
    private final Quota quota = new Quota();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSeedPath() {
        return seedPath;
    }

    public void setSeedPath(String seedPath) {
        this.seedPath = seedPath;
    }

    public Router getRouter() {
        return router;
    }

    public Lookup getLookup() {
        return lookup;
    }

    public Approval getApproval() {
        return approval;
    }

    public Quota getQuota() {
        return quota;
    }

    public static class Router {

        /**
         * Run evaluators and plugins concurrently for each item.
         */
        private boolean parallelEvaluation = false;

        private int evaluationThreads = 4;

        /**
         * Register the year and language plugins that look up missing metadata.
         */
        private boolean lookupPluginsEnabled = true;

        /**
         * Look up missing metadata once per item before any evaluator runs. Replaces the
         * lookups done by the year and language plugins.
         */
        private boolean metadataLookupEnabled = true;

        public boolean isParallelEvaluation() {
            return parallelEvaluation;
        }

        public void setParallelEvaluation(boolean parallelEvaluation) {
            this.parallelEvaluation = parallelEvaluation;
        }

        public int getEvaluationThreads() {
            return evaluationThreads;
        }

        public void setEvaluationThreads(int evaluationThreads) {
            this.evaluationThreads = evaluationThreads;
        }

        public boolean isLookupPluginsEnabled() {
            return lookupPluginsEnabled;
        }

        public void setLookupPluginsEnabled(boolean lookupPluginsEnabled) {
            this.lookupPluginsEnabled = lookupPluginsEnabled;
        }

        public boolean isMetadataLookupEnabled() {
            return metadataLookupEnabled;
        }

        public void setMetadataLookupEnabled(boolean metadataLookupEnabled) {
            this.metadataLookupEnabled = metadataLookupEnabled;
        }
    }

    public static class Lookup {

        private Duration connectTimeout = Duration.ofSeconds(3);

        private Duration readTimeout = Duration.ofSeconds(5);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class Approval {

        /**
         * How long a new request stays pending. Zero means requests never expire.
         */
        private Duration defaultExpiration = Duration.ofHours(72);

        private long expirySweepIntervalMs = 3_600_000L;

        /**
         * Days an expired request is kept before cleanup deletes it.
         */
        private int retentionDays = 30;

        public Duration getDefaultExpiration() {
            return defaultExpiration;
        }

        public void setDefaultExpiration(Duration defaultExpiration) {
            this.defaultExpiration = defaultExpiration;
        }

        public long getExpirySweepIntervalMs() {
            return expirySweepIntervalMs;
        }

        public void setExpirySweepIntervalMs(long expirySweepIntervalMs) {
            this.expirySweepIntervalMs = expirySweepIntervalMs;
        }

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
        }
    }

    public static class Quota {

        /**
         * Days of usage history kept; must cover the longest quota window.
         */
        private int usageRetentionDays = 90;

        private long cleanupIntervalMs = 86_400_000L;

        public int getUsageRetentionDays() {
            return usageRetentionDays;
        }

        public void setUsageRetentionDays(int usageRetentionDays) {
            this.usageRetentionDays = usageRetentionDays;
        }

        public long getCleanupIntervalMs() {
            return cleanupIntervalMs;
        }

        public void setCleanupIntervalMs(long cleanupIntervalMs) {
            this.cleanupIntervalMs = cleanupIntervalMs;
        }
    }
}
