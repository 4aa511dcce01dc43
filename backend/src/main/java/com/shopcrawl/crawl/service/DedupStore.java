package com.shopcrawl.crawl.service;

import com.shopcrawl.crawl.model.VisitedRecord;
import com.shopcrawl.crawl.persistence.VisitedUrlRepository;
import com.shopcrawl.crawl.util.UrlNormalizer;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Per-job record of every URL ever scheduled. Claims are write-once and never rolled back.
 */
@Service
public class DedupStore {
    private final VisitedUrlRepository repository;
    private final Clock clock;

    public DedupStore(VisitedUrlRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * @param normalizedUrl output of {@link UrlNormalizer#normalize(String)}
     * @return true for exactly one caller per (job, URL), however many processes race for it
     */
    public boolean tryClaim(String jobId, String normalizedUrl, int depth) {
        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
        return StoreGuard.call("dedup claim", () -> repository.insertIfAbsent(jobId, normalizedUrl, depth, now));
    }

    public boolean isClaimed(String jobId, String url) {
        return find(jobId, url) != null;
    }

    public VisitedRecord find(String jobId, String url) {
        String normalized = UrlNormalizer.normalize(url);
        if (normalized == null) {
            return null;
        }
        return StoreGuard.call("dedup lookup", () -> repository.find(jobId, normalized));
    }

    public long countClaimed(String jobId) {
        return StoreGuard.call("dedup count", () -> repository.countForJob(jobId));
    }
}
