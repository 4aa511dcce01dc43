package com.shopcrawl.crawl.service;

import com.shopcrawl.config.CrawlerProperties;
import com.shopcrawl.crawl.model.CrawlJob;
import com.shopcrawl.crawl.model.CrawlJobStatus;
import com.shopcrawl.crawl.model.CrawlJobView;
import com.shopcrawl.crawl.model.CrawlResultStatus;
import com.shopcrawl.crawl.model.EnqueueOutcome;
import com.shopcrawl.crawl.model.FrontierStats;
import com.shopcrawl.crawl.persistence.CrawlJobRepository;
import com.shopcrawl.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Job lifecycle. Status moves only forward: RUNNING to COMPLETED, CANCELLED or FAILED, each
 * transition a compare-and-set on the stored status.
 */
@Service
public class CrawlJobService {
    private static final Logger log = LoggerFactory.getLogger(CrawlJobService.class);
    private static final int MAX_LIST_LIMIT = 200;

    private final CrawlJobRepository jobRepository;
    private final FrontierService frontierService;
    private final DedupStore dedupStore;
    private final CrawlResultSink resultSink;
    private final CrawlerProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public CrawlJobService(
        CrawlJobRepository jobRepository,
        FrontierService frontierService,
        DedupStore dedupStore,
        CrawlResultSink resultSink,
        CrawlerProperties properties,
        TransactionTemplate transactionTemplate,
        Clock clock
    ) {
        this.jobRepository = jobRepository;
        this.frontierService = frontierService;
        this.dedupStore = dedupStore;
        this.resultSink = resultSink;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public String startJob(List<String> seedDomains, Integer maxDepth) {
        List<String> seeds = cleanSeeds(seedDomains);
        if (seeds.isEmpty()) {
            throw new IllegalArgumentException("At least one seed domain is required");
        }
        int depth = maxDepth == null ? properties.getMaxCrawlDepth() : maxDepth;
        if (depth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0");
        }

        CrawlJob job = new CrawlJob(
            UUID.randomUUID().toString(),
            seeds,
            depth,
            CrawlJobStatus.RUNNING,
            now(),
            null,
            null
        );
        // job row and seed entries commit together
        int admitted = StoreGuard.call("job create", () -> transactionTemplate.execute(status -> {
            jobRepository.insertJob(job);
            int queued = 0;
            for (String seed : seeds) {
                String seedUrl = UrlNormalizer.seedToUrl(seed);
                EnqueueOutcome outcome = seedUrl == null
                    ? EnqueueOutcome.INVALID_URL
                    : frontierService.enqueue(job, seedUrl, -1);
                if (outcome.isAdmitted()) {
                    queued++;
                } else {
                    log.warn("Seed {} for job {} not queued: {}", seed, job.id(), outcome);
                }
            }
            return queued;
        }));
        log.info("Started crawl job {} with {} seeds ({} queued), maxDepth={}", job.id(), seeds.size(), admitted, depth);
        checkCompletion(job.id());
        return job.id();
    }

    /**
     * Cancels a running job. Pending entries are dropped; in-flight ones are discarded when their
     * workers report back. Terminal jobs are returned unchanged.
     */
    public CrawlJobView cancelJob(String jobId) {
        CrawlJob job = requireJob(jobId);
        if (job.isRunning()) {
            boolean cancelled = StoreGuard.call(
                "job cancel",
                () -> jobRepository.transitionStatus(jobId, CrawlJobStatus.RUNNING, CrawlJobStatus.CANCELLED, now(), "cancelled")
            );
            if (cancelled) {
                int dropped = frontierService.dropPending(jobId);
                log.info("Cancelled crawl job {}, dropped {} pending URLs", jobId, dropped);
            }
        }
        return getJob(jobId);
    }

    /**
     * RUNNING and nothing left QUEUED, IN_FLIGHT or RETRYING means COMPLETED.
     */
    public boolean checkCompletion(String jobId) {
        CrawlJob job = StoreGuard.call("job lookup", () -> jobRepository.findJob(jobId));
        if (job == null || !job.isRunning()) {
            return false;
        }
        if (!frontierService.isDrained(jobId)) {
            return false;
        }
        boolean completed = StoreGuard.call(
            "job complete",
            () -> jobRepository.transitionStatus(jobId, CrawlJobStatus.RUNNING, CrawlJobStatus.COMPLETED, now(), null)
        );
        if (completed) {
            Map<CrawlResultStatus, Long> counts = resultSink.countByStatus(jobId);
            log.info(
                "Crawl job {} completed: {} succeeded, {} failed",
                jobId,
                counts.get(CrawlResultStatus.SUCCESS),
                counts.get(CrawlResultStatus.FAILURE)
            );
        }
        return completed;
    }

    public int checkRunningJobs() {
        List<String> running = StoreGuard.call(
            "job lookup",
            () -> jobRepository.findJobIdsByStatus(CrawlJobStatus.RUNNING)
        );
        int completed = 0;
        for (String jobId : running) {
            if (checkCompletion(jobId)) {
                completed++;
            }
        }
        return completed;
    }

    /**
     * Infrastructure fault: the job cannot make progress. URL failures never end up here.
     */
    public boolean failJob(String jobId, String detail) {
        boolean failed = StoreGuard.call(
            "job fail",
            () -> jobRepository.transitionStatus(jobId, CrawlJobStatus.RUNNING, CrawlJobStatus.FAILED, now(), detail)
        );
        if (failed) {
            int dropped = frontierService.dropPending(jobId);
            log.warn("Crawl job {} failed ({}), dropped {} pending URLs", jobId, detail, dropped);
        }
        return failed;
    }

    public boolean isRunning(String jobId) {
        CrawlJob job = StoreGuard.call("job lookup", () -> jobRepository.findJob(jobId));
        return job != null && job.isRunning();
    }

    public CrawlJob findJob(String jobId) {
        return StoreGuard.call("job lookup", () -> jobRepository.findJob(jobId));
    }

    public CrawlJobView getJob(String jobId) {
        return toView(requireJob(jobId));
    }

    public List<CrawlJobView> listJobs(Integer limit) {
        int safeLimit = limit == null ? 20 : Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        List<CrawlJob> jobs = StoreGuard.call("job list", () -> jobRepository.findRecentJobs(safeLimit));
        List<CrawlJobView> views = new ArrayList<>(jobs.size());
        for (CrawlJob job : jobs) {
            views.add(toView(job));
        }
        return views;
    }

    private CrawlJob requireJob(String jobId) {
        CrawlJob job = findJob(jobId);
        if (job == null) {
            throw new CrawlJobNotFoundException(jobId);
        }
        return job;
    }

    private CrawlJobView toView(CrawlJob job) {
        FrontierStats stats = frontierService.stats(job.id());
        Map<CrawlResultStatus, Long> results = resultSink.countByStatus(job.id());
        return new CrawlJobView(
            job.id(),
            job.status(),
            job.seedDomains(),
            job.maxDepth(),
            job.createdAt(),
            job.finishedAt(),
            job.statusDetail(),
            stats,
            dedupStore.countClaimed(job.id()),
            results.getOrDefault(CrawlResultStatus.SUCCESS, 0L),
            results.getOrDefault(CrawlResultStatus.FAILURE, 0L)
        );
    }

    private static List<String> cleanSeeds(List<String> seedDomains) {
        if (seedDomains == null) {
            return List.of();
        }
        Set<String> seeds = new LinkedHashSet<>();
        for (String seed : seedDomains) {
            if (seed != null && !seed.isBlank()) {
                seeds.add(seed.trim());
            }
        }
        return new ArrayList<>(seeds);
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
