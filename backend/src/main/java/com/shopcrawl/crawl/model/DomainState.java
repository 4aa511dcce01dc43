package com.shopcrawl.crawl.model;

import java.time.Instant;

public record DomainState(
    String domain,
    Instant lastDispatchAt,
    int inFlight,
    int consecutiveFailures,
    BreakerState breakerState,
    Instant openUntil
) {
    public static DomainState fresh(String domain) {
        return new DomainState(domain, null, 0, 0, BreakerState.CLOSED, null);
    }
}
