package com.shopcrawl.crawl.service;

import com.shopcrawl.config.CrawlerProperties;
import com.shopcrawl.crawl.model.CrawlJob;
import com.shopcrawl.crawl.model.CrawlJobStatus;
import com.shopcrawl.crawl.model.FrontierEntry;
import com.shopcrawl.crawl.persistence.CrawlJobRepository;
import com.shopcrawl.crawl.support.CrawlTestSupport;
import com.shopcrawl.crawl.support.MutableClock;
import com.shopcrawl.crawl.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class CrawlMaintenanceServiceTest {

    @Autowired
    private CrawlMaintenanceService maintenanceService;
    @Autowired
    private CrawlJobService jobService;
    @Autowired
    private FrontierService frontierService;
    @Autowired
    private CrawlJobRepository jobRepository;
    @Autowired
    private CrawlerProperties properties;
    @Autowired
    private MutableClock clock;
    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @BeforeEach
    void setUp() {
        CrawlTestSupport.clearTables(jdbc);
        CrawlTestSupport.applyTestDefaults(properties);
        clock.reset();
    }

    @Test
    void passRecoversLeasesPurgesStoppedJobsAndCompletesDrainedOnes() {
        String crashed = jobService.startJob(List.of(CrawlTestSupport.uniqueDomain("crashed")), 0);
        frontierService.dequeueReady("dead-worker").orElseThrow();

        String stopped = jobService.startJob(List.of(CrawlTestSupport.uniqueDomain("stopped")), 0);
        jobRepository.transitionStatus(stopped, CrawlJobStatus.RUNNING, CrawlJobStatus.CANCELLED, clock.instant(), "cancelled");

        properties.setMaxRetries(0);
        clock.advance(Duration.ofSeconds(121));
        CrawlMaintenanceService.MaintenancePass pass = maintenanceService.runOnce();

        assertEquals(1, pass.leases().dead());
        assertEquals(1, pass.purged());
        assertEquals(1, pass.completedJobs());
        assertEquals(CrawlJobStatus.COMPLETED, jobService.getJob(crashed).status());
        assertEquals(1, jobService.getJob(crashed).failed());
        assertEquals(0, frontierService.entriesForJob(stopped).size());

        CrawlMaintenanceService.MaintenancePass idle = maintenanceService.runOnce();
        assertEquals(0, idle.leases().examined());
        assertEquals(0, idle.purged());
        assertEquals(0, idle.completedJobs());
    }

    @Test
    void leaseOfStoppedJobIsDroppedWithoutResult() {
        String jobId = jobService.startJob(List.of(CrawlTestSupport.uniqueDomain("shop")), 0);
        FrontierEntry leased = frontierService.dequeueReady("w1").orElseThrow();
        jobService.cancelJob(jobId);

        clock.advance(Duration.ofSeconds(121));
        CrawlMaintenanceService.MaintenancePass pass = maintenanceService.runOnce();

        CrawlJob job = jobService.findJob(jobId);
        assertEquals(CrawlJobStatus.CANCELLED, job.status());
        assertEquals(1, pass.leases().dead());
        assertEquals(0, jobService.getJob(jobId).failed());
        assertEquals(0, frontierService.entriesForJob(leased.jobId()).size());
    }
}
