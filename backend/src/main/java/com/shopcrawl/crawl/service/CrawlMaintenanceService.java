package com.shopcrawl.crawl.service;

import com.shopcrawl.config.CrawlerProperties;
import com.shopcrawl.crawl.model.LeaseRecoverySummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic housekeeping: recovers expired leases, purges pending work of stopped jobs and
 * completes drained jobs. Idempotent, so every process may run it.
 */
@Service
public class CrawlMaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(CrawlMaintenanceService.class);

    private final FrontierService frontierService;
    private final CrawlJobService jobService;
    private final CrawlerProperties properties;
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;

    public CrawlMaintenanceService(
        FrontierService frontierService,
        CrawlJobService jobService,
        CrawlerProperties properties
    ) {
        this.frontierService = frontierService;
        this.jobService = jobService;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (!properties.getMaintenance().isEnabled()) {
            return;
        }
        synchronized (lifecycleLock) {
            long intervalMs = properties.getMaintenance().getIntervalMs();
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("crawl-maintenance");
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleWithFixedDelay(this::runSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }
    }

    @PreDestroy
    public void stop() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                scheduler.shutdownNow();
                scheduler = null;
            }
        }
    }

    public MaintenancePass runOnce() {
        LeaseRecoverySummary leases = frontierService.recoverExpiredLeases();
        int purged = frontierService.purgeInactiveJobs();
        int completed = jobService.checkRunningJobs();
        if (purged > 0) {
            log.info("Purged {} pending URLs of stopped jobs", purged);
        }
        return new MaintenancePass(leases, purged, completed);
    }

    private void runSafely() {
        try {
            runOnce();
        } catch (Exception e) {
            log.warn("Crawl maintenance pass failed", e);
        }
    }

    public record MaintenancePass(LeaseRecoverySummary leases, int purged, int completedJobs) {}
}
