package com.shopcrawl.crawl.model;

import java.time.Instant;

public record FrontierEntry(
    long id,
    String jobId,
    String url,
    String domain,
    int depth,
    Instant discoveredAt,
    int attemptCount,
    FrontierEntryState state,
    Instant nextAttemptAt,
    String leaseOwner,
    Instant leaseExpiresAt,
    String lastErrorClass,
    Integer lastHttpStatus
) {
    /**
     * The entry as seen by the worker that just leased it.
     */
    public FrontierEntry leasedTo(String owner, Instant expiresAt) {
        return new FrontierEntry(
            id,
            jobId,
            url,
            domain,
            depth,
            discoveredAt,
            attemptCount + 1,
            FrontierEntryState.IN_FLIGHT,
            nextAttemptAt,
            owner,
            expiresAt,
            lastErrorClass,
            lastHttpStatus
        );
    }

    public WorkUnit toWorkUnit() {
        return new WorkUnit(jobId, url, depth, domain, attemptCount);
    }
}
