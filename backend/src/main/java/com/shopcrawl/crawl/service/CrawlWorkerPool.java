package com.shopcrawl.crawl.service;

import com.shopcrawl.config.CrawlerProperties;
import com.shopcrawl.crawl.http.PageFetcher;
import com.shopcrawl.crawl.links.LinkExtractor;
import com.shopcrawl.crawl.model.CrawlJob;
import com.shopcrawl.crawl.model.CrawlResult;
import com.shopcrawl.crawl.model.EnqueueOutcome;
import com.shopcrawl.crawl.model.FrontierEntry;
import com.shopcrawl.crawl.model.FrontierEntryState;
import com.shopcrawl.crawl.model.HttpFetchResult;
import com.shopcrawl.crawl.model.WorkUnit;
import com.shopcrawl.crawl.model.WorkerPoolStatusResponse;
import com.shopcrawl.crawl.util.FetchErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pull-based workers. Each thread leases one entry at a time from the shared frontier, fetches
 * it without holding any store lock, feeds discovered links back and reports the outcome.
 */
@Service
public class CrawlWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(CrawlWorkerPool.class);
    private static final int MAX_DETAIL_LENGTH = 300;

    private final FrontierService frontierService;
    private final CrawlJobService jobService;
    private final CrawlResultSink resultSink;
    private final PageFetcher pageFetcher;
    private final LinkExtractor linkExtractor;
    private final CrawlerProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger activeFetches = new AtomicInteger();
    private final AtomicLong processedCount = new AtomicLong();
    private final Object lifecycleLock = new Object();
    private final String instanceId;

    private ExecutorService executor;
    private int activeWorkerCount;

    public CrawlWorkerPool(
        FrontierService frontierService,
        CrawlJobService jobService,
        CrawlResultSink resultSink,
        PageFetcher pageFetcher,
        LinkExtractor linkExtractor,
        CrawlerProperties properties,
        Clock clock
    ) {
        this.frontierService = frontierService;
        this.jobService = jobService;
        this.resultSink = resultSink;
        this.pageFetcher = pageFetcher;
        this.linkExtractor = linkExtractor;
        this.properties = properties;
        this.clock = clock;
        this.instanceId = "worker-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getWorkers().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public WorkerPoolStatusResponse getStatus() {
        return new WorkerPoolStatusResponse(running.get(), activeWorkerCount, activeFetches.get(), processedCount.get());
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int workerCount = properties.getWorkers().getWorkerCount();
            int pollIntervalMs = properties.getWorkers().getPollIntervalMs();
            activeWorkerCount = workerCount;
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("crawl-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                executor.submit(() -> workerLoop(workerIndex, pollIntervalMs));
            }
            log.info("Started {} crawl workers as {}", workerCount, instanceId);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            activeWorkerCount = 0;
            log.info("Stopped crawl workers");
        }
    }

    /**
     * Leases and processes at most one entry. Returns false when nothing was ready.
     */
    public boolean runOnce(String workerId) {
        Optional<FrontierEntry> next = frontierService.dequeueReady(workerId);
        if (next.isEmpty()) {
            return false;
        }
        FrontierEntry entry = next.get();
        try {
            process(entry);
        } catch (CrawlStoreException e) {
            log.warn("Store fault while processing {} for job {}", entry.url(), entry.jobId(), e);
            jobService.failJob(entry.jobId(), truncate("store_fault: " + e.getMessage()));
        } finally {
            processedCount.incrementAndGet();
        }
        return true;
    }

    void process(FrontierEntry entry) {
        CrawlJob job = jobService.findJob(entry.jobId());
        if (job == null || !job.isRunning()) {
            frontierService.discard(entry);
            log.debug("Discarded {}: job {} no longer running", entry.url(), entry.jobId());
            return;
        }

        HttpFetchResult fetch;
        activeFetches.incrementAndGet();
        try {
            fetch = pageFetcher.fetch(entry.url());
        } finally {
            activeFetches.decrementAndGet();
        }

        // cancellation is cooperative: whatever came back is dropped
        if (!jobService.isRunning(entry.jobId())) {
            frontierService.discard(entry);
            log.debug("Discarded result for {}: job {} stopped during fetch", entry.url(), entry.jobId());
            return;
        }

        WorkUnit unit = entry.toWorkUnit();
        if (fetch.isSuccessful()) {
            handleSuccess(job, entry, unit, fetch);
        } else {
            handleFailure(entry, unit, fetch);
        }
        jobService.checkCompletion(entry.jobId());
    }

    private void handleSuccess(CrawlJob job, FrontierEntry entry, WorkUnit unit, HttpFetchResult fetch) {
        List<String> links = isHtml(fetch.contentType())
            ? linkExtractor.extract(fetch.body(), fetch.finalUrlOrRequested())
            : List.of();
        Map<EnqueueOutcome, Integer> outcomes = frontierService.enqueueAll(job, links, entry.depth());
        resultSink.record(CrawlResult.success(unit, links, fetch.statusCode(), fetch.durationMs(), Instant.now(clock)));
        if (!frontierService.ack(entry)) {
            log.warn("Lease for {} was lost before ack; another worker owns it now", entry.url());
            return;
        }
        log.debug(
            "Fetched {} (depth {}, status {}): {} links, outcomes {}",
            entry.url(),
            entry.depth(),
            fetch.statusCode(),
            links.size(),
            outcomes
        );
    }

    private void handleFailure(FrontierEntry entry, WorkUnit unit, HttpFetchResult fetch) {
        String errorClass = FetchErrorClassifier.classify(fetch);
        boolean retryable = FetchErrorClassifier.isRetryable(errorClass);
        Integer httpStatus = fetch.httpStatusOrNull();
        Optional<FrontierEntryState> state = frontierService.fail(entry, retryable, errorClass, httpStatus);
        if (state.isEmpty()) {
            log.warn("Lease for {} was lost before failure report", entry.url());
            return;
        }
        if (state.get() == FrontierEntryState.DEAD) {
            resultSink.record(CrawlResult.failure(unit, httpStatus, errorClass, fetch.durationMs(), Instant.now(clock)));
            log.warn("Giving up on {} after {} attempts: {}", entry.url(), entry.attemptCount(), errorClass);
        } else {
            log.warn("Fetch of {} failed ({}), attempt {} will be retried", entry.url(), errorClass, entry.attemptCount());
        }
    }

    private void workerLoop(int workerIndex, int pollIntervalMs) {
        Thread.currentThread().setName("crawl-worker-" + workerIndex);
        String workerId = instanceId + "#" + workerIndex;
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            boolean worked;
            try {
                worked = runOnce(workerId);
            } catch (Exception e) {
                log.warn("Crawl worker {} hit an error", workerIndex, e);
                worked = false;
            }
            if (!worked) {
                sleep(pollIntervalMs);
            }
        }
    }

    private static boolean isHtml(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return true;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.contains("html") || lower.startsWith("text/");
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= MAX_DETAIL_LENGTH) {
            return detail;
        }
        return detail.substring(0, MAX_DETAIL_LENGTH);
    }

    private void sleep(int pollIntervalMs) {
        try {
            TimeUnit.MILLISECONDS.sleep(pollIntervalMs);
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
