package com.flowgraph.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine settings, bound from {@code flowgraph.*}.
 *
 * <pre>
 * flowgraph:
 *   persistence: jdbc        # memory (default) or jdbc
 *   lock-timeout: 5s
 *   validation:
 *     report-all: true       # false stops at the first violation
 *   metrics:
 *     application-tag: billing   # common "application" tag; unset leaves the registries alone
 * </pre>
 */
@ConfigurationProperties(prefix = "flowgraph")
public class FlowgraphProperties {

    public enum Persistence {
        MEMORY,
        JDBC
    }

    private Persistence persistence = Persistence.MEMORY;

    /**
     * How long a writer waits for an instance lock before giving up with a
     * retryable conflict.
     */
    private Duration lockTimeout = Duration.ofSeconds(5);

    private final Validation validation = new Validation();

    private final Metrics metrics = new Metrics();

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    public Validation getValidation() {
        return validation;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Validation {

        private boolean reportAll = true;

        public boolean isReportAll() {
            return reportAll;
        }

        public void setReportAll(boolean reportAll) {
            this.reportAll = reportAll;
        }
    }

    public static class Metrics {

        private String applicationTag;

        public String getApplicationTag() {
            return applicationTag;
        }

        public void setApplicationTag(String applicationTag) {
            this.applicationTag = applicationTag;
        }
    }
}
