package com.shopcrawl.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed crawler configuration bound from the {@code crawler.*} namespace.
 * Setters and getters clamp out-of-range values to the nearest safe value instead of failing startup.
 */
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "shop-crawler/0.1 (+contact)";

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private int maxCrawlDepth = 3;
    private long politenessIntervalMs = 1000;
    private int domainConcurrencyCap = 2;
    private int maxRetries = 3;
    private long retryBackoffBaseMs = 1000;
    private long retryBackoffMaxMs = 300_000;
    private int failureThreshold = 3;
    private long cooldownMs = 60_000;
    private int leaseTimeoutSeconds = 120;
    private boolean sameDomainOnly = true;
    private int maxLinksPerPage = 500;
    private int maxBodyBytes = 5 * 1024 * 1024;
    private Workers workers = new Workers();
    private Maintenance maintenance = new Maintenance();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getMaxCrawlDepth() {
        return Math.max(0, maxCrawlDepth);
    }

    public void setMaxCrawlDepth(int maxCrawlDepth) {
        this.maxCrawlDepth = Math.max(0, maxCrawlDepth);
    }

    public long getPolitenessIntervalMs() {
        return Math.max(0L, politenessIntervalMs);
    }

    public void setPolitenessIntervalMs(long politenessIntervalMs) {
        this.politenessIntervalMs = Math.max(0L, politenessIntervalMs);
    }

    public int getDomainConcurrencyCap() {
        return Math.max(1, domainConcurrencyCap);
    }

    public void setDomainConcurrencyCap(int domainConcurrencyCap) {
        this.domainConcurrencyCap = Math.max(1, domainConcurrencyCap);
    }

    public int getMaxRetries() {
        return Math.max(0, maxRetries);
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = Math.max(0, maxRetries);
    }

    public long getRetryBackoffBaseMs() {
        return Math.max(0L, retryBackoffBaseMs);
    }

    public void setRetryBackoffBaseMs(long retryBackoffBaseMs) {
        this.retryBackoffBaseMs = Math.max(0L, retryBackoffBaseMs);
    }

    public long getRetryBackoffMaxMs() {
        return Math.max(getRetryBackoffBaseMs(), retryBackoffMaxMs);
    }

    public void setRetryBackoffMaxMs(long retryBackoffMaxMs) {
        this.retryBackoffMaxMs = Math.max(0L, retryBackoffMaxMs);
    }

    public int getFailureThreshold() {
        return Math.max(1, failureThreshold);
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = Math.max(1, failureThreshold);
    }

    public long getCooldownMs() {
        return Math.max(0L, cooldownMs);
    }

    public void setCooldownMs(long cooldownMs) {
        this.cooldownMs = Math.max(0L, cooldownMs);
    }

    public int getLeaseTimeoutSeconds() {
        return Math.max(1, leaseTimeoutSeconds);
    }

    public void setLeaseTimeoutSeconds(int leaseTimeoutSeconds) {
        this.leaseTimeoutSeconds = Math.max(1, leaseTimeoutSeconds);
    }

    public boolean isSameDomainOnly() {
        return sameDomainOnly;
    }

    public void setSameDomainOnly(boolean sameDomainOnly) {
        this.sameDomainOnly = sameDomainOnly;
    }

    public int getMaxLinksPerPage() {
        return Math.max(1, maxLinksPerPage);
    }

    public void setMaxLinksPerPage(int maxLinksPerPage) {
        this.maxLinksPerPage = Math.max(1, maxLinksPerPage);
    }

    public int getMaxBodyBytes() {
        return Math.max(1024, maxBodyBytes);
    }

    public void setMaxBodyBytes(int maxBodyBytes) {
        this.maxBodyBytes = Math.max(1024, maxBodyBytes);
    }

    public Workers getWorkers() {
        return workers;
    }

    public void setWorkers(Workers workers) {
        this.workers = workers;
    }

    public Maintenance getMaintenance() {
        return maintenance;
    }

    public void setMaintenance(Maintenance maintenance) {
        this.maintenance = maintenance;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Workers {
        private boolean enabled = true;
        private int workerCount = 4;
        private int pollIntervalMs = 250;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }

        public int getPollIntervalMs() {
            return Math.max(10, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(10, pollIntervalMs);
        }
    }

    public static class Maintenance {
        private boolean enabled = true;
        private long intervalMs = 5000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return Math.max(100L, intervalMs);
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = Math.max(100L, intervalMs);
        }
    }

    public static class Cli {
        private boolean run;
        private String domains = "";
        private Integer maxDepth;
        private int waitTimeoutSeconds = 600;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getDomains() {
            return domains == null ? "" : domains;
        }

        public void setDomains(String domains) {
            this.domains = domains;
        }

        public Integer getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(Integer maxDepth) {
            this.maxDepth = maxDepth;
        }

        public int getWaitTimeoutSeconds() {
            return Math.max(1, waitTimeoutSeconds);
        }

        public void setWaitTimeoutSeconds(int waitTimeoutSeconds) {
            this.waitTimeoutSeconds = Math.max(1, waitTimeoutSeconds);
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
