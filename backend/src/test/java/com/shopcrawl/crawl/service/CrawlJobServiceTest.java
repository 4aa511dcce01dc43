package com.shopcrawl.crawl.service;

import com.shopcrawl.config.CrawlerProperties;
import com.shopcrawl.crawl.model.CrawlJobStatus;
import com.shopcrawl.crawl.model.CrawlJobView;
import com.shopcrawl.crawl.model.FrontierEntry;
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

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class CrawlJobServiceTest {

    @Autowired
    private CrawlJobService jobService;
    @Autowired
    private FrontierService frontierService;
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
    void startQueuesOneSeedPerDistinctDomain() {
        String a = CrawlTestSupport.uniqueDomain("shop");
        String b = CrawlTestSupport.uniqueDomain("shop");

        String jobId = jobService.startJob(Arrays.asList(a, " " + a + " ", b, "", null), null);

        CrawlJobView view = jobService.getJob(jobId);
        assertEquals(CrawlJobStatus.RUNNING, view.status());
        assertEquals(List.of(a, b), view.seedDomains());
        assertEquals(3, view.maxDepth());
        assertEquals(2, view.frontier().queued());
        assertEquals(2, view.urlsClaimed());
        assertThat(frontierService.entriesForJob(jobId))
            .extracting(FrontierEntry::url)
            .containsExactlyInAnyOrder("https://" + a + "/", "https://" + b + "/");
    }

    @Test
    void startRejectsMissingSeedsAndNegativeDepth() {
        assertThatThrownBy(() -> jobService.startJob(List.of(), 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> jobService.startJob(List.of("  "), 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> jobService.startJob(List.of(CrawlTestSupport.uniqueDomain("shop")), -1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void jobWithNoValidSeedCompletesImmediately() {
        String jobId = jobService.startJob(List.of("not a domain"), 1);

        CrawlJobView view = jobService.getJob(jobId);
        assertEquals(CrawlJobStatus.COMPLETED, view.status());
        assertThat(view.finishedAt()).isNotNull();
    }

    @Test
    void cancelDropsPendingWorkAndIsIdempotent() {
        String domain = CrawlTestSupport.uniqueDomain("shop");
        String jobId = jobService.startJob(List.of(domain), 1);

        CrawlJobView cancelled = jobService.cancelJob(jobId);
        CrawlJobView again = jobService.cancelJob(jobId);

        assertEquals(CrawlJobStatus.CANCELLED, cancelled.status());
        assertEquals(0, cancelled.frontier().live());
        assertEquals(CrawlJobStatus.CANCELLED, again.status());
        assertEquals(cancelled.finishedAt(), again.finishedAt());
        assertFalse(jobService.isRunning(jobId));
    }

    @Test
    void unknownJobIsNotFound() {
        assertThatThrownBy(() -> jobService.getJob("no-such-job"))
            .isInstanceOf(CrawlJobNotFoundException.class);
        assertThatThrownBy(() -> jobService.cancelJob("no-such-job"))
            .isInstanceOf(CrawlJobNotFoundException.class);
    }

    @Test
    void completesOnlyOnceFrontierIsDrained() {
        String domain = CrawlTestSupport.uniqueDomain("shop");
        String jobId = jobService.startJob(List.of(domain), 0);
        FrontierEntry entry = frontierService.dequeueReady("w1").orElseThrow();

        assertFalse(jobService.checkCompletion(jobId));

        frontierService.ack(entry);
        assertTrue(jobService.checkCompletion(jobId));
        assertFalse(jobService.checkCompletion(jobId));
        assertEquals(CrawlJobStatus.COMPLETED, jobService.getJob(jobId).status());
    }

    @Test
    void terminalStatusNeverChanges() {
        String domain = CrawlTestSupport.uniqueDomain("shop");
        String jobId = jobService.startJob(List.of(domain), 0);

        assertTrue(jobService.failJob(jobId, "store_fault: disk full"));
        assertFalse(jobService.failJob(jobId, "again"));
        CrawlJobView view = jobService.cancelJob(jobId);

        assertEquals(CrawlJobStatus.FAILED, view.status());
        assertEquals("store_fault: disk full", view.statusDetail());
        assertEquals(0, view.frontier().live());
    }

    @Test
    void listsNewestJobsFirst() {
        String first = jobService.startJob(List.of(CrawlTestSupport.uniqueDomain("shop")), 0);
        clock.plusMillis(1000);
        String second = jobService.startJob(List.of(CrawlTestSupport.uniqueDomain("shop")), 0);

        List<CrawlJobView> jobs = jobService.listJobs(10);

        assertThat(jobs).extracting(CrawlJobView::jobId).containsExactly(second, first);
        assertThat(jobService.listJobs(1)).hasSize(1);
    }
}
