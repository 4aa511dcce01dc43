package com.shopcrawl.crawl.service;

import com.shopcrawl.crawl.model.LeaseRecoverySummary;
import com.shopcrawl.crawl.persistence.CrawlJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Startup pass over work left behind by a previous run: expired leases are requeued and jobs
 * that drained while nobody was watching are completed.
 */
@Component
@Order(0)
public class LeaseRecoveryRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(LeaseRecoveryRunner.class);

    private final CrawlJobRepository jobRepository;
    private final FrontierService frontierService;
    private final CrawlJobService jobService;

    public LeaseRecoveryRunner(
        CrawlJobRepository jobRepository,
        FrontierService frontierService,
        CrawlJobService jobService
    ) {
        this.jobRepository = jobRepository;
        this.frontierService = frontierService;
        this.jobService = jobService;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = jobRepository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping lease recovery because database is unreachable");
            return;
        }

        LeaseRecoverySummary summary = frontierService.recoverExpiredLeases();
        int purged = frontierService.purgeInactiveJobs();
        int completed = jobService.checkRunningJobs();
        log.info(
            "Startup recovery: {} expired leases ({} requeued, {} dead), {} stale pending URLs purged, {} jobs completed",
            summary.examined(),
            summary.requeued(),
            summary.dead(),
            purged,
            completed
        );
    }
}
