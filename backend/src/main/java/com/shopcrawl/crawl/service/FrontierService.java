package com.shopcrawl.crawl.service;

import com.shopcrawl.config.CrawlerProperties;
import com.shopcrawl.crawl.model.CrawlJob;
import com.shopcrawl.crawl.model.CrawlResult;
import com.shopcrawl.crawl.model.EnqueueOutcome;
import com.shopcrawl.crawl.model.FrontierEntry;
import com.shopcrawl.crawl.model.FrontierEntryState;
import com.shopcrawl.crawl.model.FrontierStats;
import com.shopcrawl.crawl.model.LeaseRecoverySummary;
import com.shopcrawl.crawl.persistence.CrawlJobRepository;
import com.shopcrawl.crawl.persistence.FrontierRepository;
import com.shopcrawl.crawl.util.FetchErrorClassifier;
import com.shopcrawl.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Depth-aware work queue shared by every worker. Admission goes through scope, depth and
 * dedup checks; dispatch is gated per domain by {@link PolitenessController}; every state
 * change out of IN_FLIGHT is guarded by the lease (owner and attempt) it was handed out with.
 */
@Service
public class FrontierService {
    private static final Logger log = LoggerFactory.getLogger(FrontierService.class);
    private static final int MAX_URL_LENGTH = 2048;
    private static final int DOMAIN_SCAN_LIMIT = 500;
    private static final int CANDIDATES_PER_DOMAIN = 5;
    private static final int LEASE_RECOVERY_BATCH = 200;

    private final FrontierRepository frontierRepository;
    private final CrawlJobRepository jobRepository;
    private final DedupStore dedupStore;
    private final PolitenessController politeness;
    private final CrawlResultSink resultSink;
    private final CrawlerProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final AtomicReference<String> lastServedDomain = new AtomicReference<>();

    public FrontierService(
        FrontierRepository frontierRepository,
        CrawlJobRepository jobRepository,
        DedupStore dedupStore,
        PolitenessController politeness,
        CrawlResultSink resultSink,
        CrawlerProperties properties,
        TransactionTemplate transactionTemplate,
        Clock clock
    ) {
        this.frontierRepository = frontierRepository;
        this.jobRepository = jobRepository;
        this.dedupStore = dedupStore;
        this.politeness = politeness;
        this.resultSink = resultSink;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Seeds are enqueued with {@code parentDepth = -1}.
     */
    public EnqueueOutcome enqueue(String jobId, String url, int parentDepth) {
        CrawlJob job = StoreGuard.call("job lookup", () -> jobRepository.findJob(jobId));
        if (job == null) {
            return UrlNormalizer.normalize(url) == null ? EnqueueOutcome.INVALID_URL : EnqueueOutcome.JOB_NOT_RUNNING;
        }
        return enqueue(job, url, parentDepth);
    }

    public EnqueueOutcome enqueue(CrawlJob job, String url, int parentDepth) {
        String normalized = UrlNormalizer.normalize(url);
        if (normalized == null || normalized.length() > MAX_URL_LENGTH) {
            return EnqueueOutcome.INVALID_URL;
        }
        if (!job.isRunning()) {
            return EnqueueOutcome.JOB_NOT_RUNNING;
        }
        int depth = parentDepth + 1;
        if (depth > job.maxDepth()) {
            return EnqueueOutcome.DEPTH_EXCEEDED;
        }
        if (properties.isSameDomainOnly() && !UrlNormalizer.isWithinDomains(normalized, job.seedDomains())) {
            return EnqueueOutcome.OUT_OF_SCOPE;
        }
        String domain = UrlNormalizer.domainOf(normalized);
        if (domain == null) {
            return EnqueueOutcome.INVALID_URL;
        }
        Instant now = now();
        EnqueueOutcome outcome = StoreGuard.call("enqueue", () -> transactionTemplate.execute(status -> {
            if (!dedupStore.tryClaim(job.id(), normalized, depth)) {
                return EnqueueOutcome.DUPLICATE;
            }
            frontierRepository.insertQueued(job.id(), normalized, domain, depth, now);
            return EnqueueOutcome.ADMITTED;
        }));
        if (outcome == EnqueueOutcome.ADMITTED) {
            log.debug("Queued {} at depth {} for job {}", normalized, depth, job.id());
        }
        return outcome;
    }

    public Map<EnqueueOutcome, Integer> enqueueAll(CrawlJob job, Collection<String> urls, int parentDepth) {
        Map<EnqueueOutcome, Integer> outcomes = new EnumMap<>(EnqueueOutcome.class);
        for (String url : urls) {
            outcomes.merge(enqueue(job, url, parentDepth), 1, Integer::sum);
        }
        return outcomes;
    }

    /**
     * Leases the next dispatchable entry to {@code workerId}, scanning domains with ready work
     * round-robin from the one this instance served last.
     */
    public Optional<FrontierEntry> dequeueReady(String workerId) {
        Instant now = now();
        List<String> domains = StoreGuard.call("dequeue", () -> {
            frontierRepository.promoteDueRetries(now);
            return frontierRepository.findReadyDomains(now, DOMAIN_SCAN_LIMIT);
        });
        if (domains.isEmpty()) {
            return Optional.empty();
        }
        for (String domain : rotate(domains, lastServedDomain.get())) {
            Optional<FrontierEntry> leased = leaseFromDomain(domain, workerId, now);
            if (leased.isPresent()) {
                lastServedDomain.set(domain);
                log.debug("Dispatched {} (attempt {}) to {}", leased.get().url(), leased.get().attemptCount(), workerId);
                return leased;
            }
        }
        return Optional.empty();
    }

    /**
     * IN_FLIGHT to DONE. False when the lease was lost and someone else owns the entry now.
     */
    public boolean ack(FrontierEntry entry) {
        return StoreGuard.call("ack", () -> Boolean.TRUE.equals(transactionTemplate.execute(status -> {
            if (!frontierRepository.deleteLeased(entry.id(), entry.leaseOwner(), entry.attemptCount())) {
                return false;
            }
            politeness.release(entry.domain(), true);
            return true;
        })));
    }

    /**
     * IN_FLIGHT to RETRYING (with backoff) or DEAD. Empty when the lease was lost.
     */
    public Optional<FrontierEntryState> fail(
        FrontierEntry entry,
        boolean retryable,
        String errorClass,
        Integer httpStatus
    ) {
        boolean retry = willRetry(entry.attemptCount(), retryable);
        Instant now = now();
        FrontierEntryState result = StoreGuard.call("fail", () -> transactionTemplate.execute(status -> {
            boolean moved = retry
                ? frontierRepository.markRetrying(
                    entry.id(),
                    entry.leaseOwner(),
                    entry.attemptCount(),
                    now.plusMillis(backoffDelayMs(entry.attemptCount())),
                    errorClass,
                    httpStatus,
                    now
                )
                : frontierRepository.deleteLeased(entry.id(), entry.leaseOwner(), entry.attemptCount());
            if (!moved) {
                return null;
            }
            politeness.release(entry.domain(), false);
            return retry ? FrontierEntryState.RETRYING : FrontierEntryState.DEAD;
        }));
        return Optional.ofNullable(result);
    }

    /**
     * Drops an in-flight entry whose job stopped running. No failure accounting.
     */
    public boolean discard(FrontierEntry entry) {
        return StoreGuard.call("discard", () -> Boolean.TRUE.equals(transactionTemplate.execute(status -> {
            if (!frontierRepository.deleteLeased(entry.id(), entry.leaseOwner(), entry.attemptCount())) {
                return false;
            }
            politeness.releaseAbandoned(entry.domain());
            return true;
        })));
    }

    /**
     * Treats every expired lease as a retryable failure. Each expired lease is recovered once,
     * however many processes run this concurrently.
     */
    public LeaseRecoverySummary recoverExpiredLeases() {
        Instant now = now();
        List<FrontierEntry> expired = StoreGuard.call(
            "lease scan",
            () -> frontierRepository.findExpiredLeases(now, LEASE_RECOVERY_BATCH)
        );
        Map<String, Boolean> jobRunning = new HashMap<>();
        int requeued = 0;
        int dead = 0;
        for (FrontierEntry entry : expired) {
            boolean running = jobRunning.computeIfAbsent(entry.jobId(), this::isJobRunning);
            FrontierEntryState outcome = recoverLease(entry, running, now);
            if (outcome == FrontierEntryState.RETRYING) {
                requeued++;
            } else if (outcome == FrontierEntryState.DEAD) {
                dead++;
                if (running) {
                    resultSink.record(CrawlResult.failure(
                        entry.toWorkUnit(),
                        null,
                        FetchErrorClassifier.LEASE_EXPIRED,
                        0L,
                        now
                    ));
                }
            }
        }
        if (requeued + dead > 0) {
            log.info("Recovered {} expired leases ({} requeued, {} dead)", requeued + dead, requeued, dead);
        }
        return new LeaseRecoverySummary(expired.size(), requeued, dead);
    }

    public int dropPending(String jobId) {
        return StoreGuard.call("drop pending", () -> frontierRepository.deletePending(jobId));
    }

    public int purgeInactiveJobs() {
        return StoreGuard.call("purge inactive", frontierRepository::deletePendingOfInactiveJobs);
    }

    public boolean isDrained(String jobId) {
        return stats(jobId).live() == 0;
    }

    public FrontierStats stats(String jobId) {
        return StoreGuard.call("frontier stats", () -> frontierRepository.stats(jobId));
    }

    public List<FrontierEntry> entriesForJob(String jobId) {
        return StoreGuard.call("frontier lookup", () -> frontierRepository.findEntriesForJob(jobId));
    }

    /**
     * {@code attemptCount} is the number of attempts already made, including the one that just failed.
     */
    public boolean willRetry(int attemptCount, boolean retryable) {
        return retryable && attemptCount <= properties.getMaxRetries();
    }

    public long backoffDelayMs(int attemptCount) {
        long base = properties.getRetryBackoffBaseMs();
        long max = properties.getRetryBackoffMaxMs();
        int shift = Math.min(Math.max(0, attemptCount - 1), 30);
        if (base > (max >> shift)) {
            return max;
        }
        return Math.min(base << shift, max);
    }

    private Optional<FrontierEntry> leaseFromDomain(String domain, String workerId, Instant now) {
        List<FrontierEntry> candidates = StoreGuard.call(
            "dequeue",
            () -> frontierRepository.findReadyForDomain(domain, now, CANDIDATES_PER_DOMAIN)
        );
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        Instant leaseExpiresAt = now.plusSeconds(properties.getLeaseTimeoutSeconds());
        FrontierEntry leased = StoreGuard.call("dequeue", () -> transactionTemplate.execute(status -> {
            if (!politeness.admitDispatch(domain, now)) {
                return null;
            }
            for (FrontierEntry candidate : candidates) {
                if (frontierRepository.claim(candidate.id(), workerId, now, leaseExpiresAt)) {
                    return candidate.leasedTo(workerId, leaseExpiresAt);
                }
            }
            // every candidate went to another worker; give the admission back
            status.setRollbackOnly();
            return null;
        }));
        return Optional.ofNullable(leased);
    }

    private FrontierEntryState recoverLease(FrontierEntry entry, boolean jobRunning, Instant now) {
        boolean retry = jobRunning && willRetry(entry.attemptCount(), true);
        return StoreGuard.call("lease recovery", () -> transactionTemplate.execute(status -> {
            boolean moved = retry
                ? frontierRepository.requeueExpired(
                    entry.id(),
                    entry.leaseOwner(),
                    entry.attemptCount(),
                    now.plusMillis(backoffDelayMs(entry.attemptCount())),
                    FetchErrorClassifier.LEASE_EXPIRED,
                    now
                )
                : frontierRepository.deleteExpired(entry.id(), entry.leaseOwner(), entry.attemptCount(), now);
            if (!moved) {
                return null;
            }
            politeness.releaseAbandoned(entry.domain());
            return retry ? FrontierEntryState.RETRYING : FrontierEntryState.DEAD;
        }));
    }

    private boolean isJobRunning(String jobId) {
        CrawlJob job = StoreGuard.call("job lookup", () -> jobRepository.findJob(jobId));
        return job != null && job.isRunning();
    }

    static List<String> rotate(List<String> domains, String lastServed) {
        if (lastServed == null || domains.size() < 2) {
            return domains;
        }
        int start = 0;
        for (int i = 0; i < domains.size(); i++) {
            if (domains.get(i).compareTo(lastServed) > 0) {
                start = i;
                break;
            }
        }
        List<String> rotated = new ArrayList<>(domains.size());
        rotated.addAll(domains.subList(start, domains.size()));
        rotated.addAll(domains.subList(0, start));
        return rotated;
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
