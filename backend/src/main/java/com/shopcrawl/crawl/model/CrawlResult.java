package com.shopcrawl.crawl.model;

import java.time.Instant;
import java.util.List;

public record CrawlResult(
    String jobId,
    String url,
    String domain,
    int depth,
    CrawlResultStatus status,
    List<String> links,
    Integer httpStatus,
    String errorClass,
    long fetchDurationMs,
    int attempt,
    Instant recordedAt
) {
    public static CrawlResult success(
        WorkUnit unit,
        List<String> links,
        int httpStatus,
        long fetchDurationMs,
        Instant recordedAt
    ) {
        return new CrawlResult(
            unit.jobId(),
            unit.url(),
            unit.domain(),
            unit.depth(),
            CrawlResultStatus.SUCCESS,
            links == null ? List.of() : List.copyOf(links),
            httpStatus,
            null,
            fetchDurationMs,
            unit.attempt(),
            recordedAt
        );
    }

    public static CrawlResult failure(
        WorkUnit unit,
        Integer httpStatus,
        String errorClass,
        long fetchDurationMs,
        Instant recordedAt
    ) {
        return new CrawlResult(
            unit.jobId(),
            unit.url(),
            unit.domain(),
            unit.depth(),
            CrawlResultStatus.FAILURE,
            List.of(),
            httpStatus,
            errorClass,
            fetchDurationMs,
            unit.attempt(),
            recordedAt
        );
    }
}
