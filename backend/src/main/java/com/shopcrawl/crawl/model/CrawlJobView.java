package com.shopcrawl.crawl.model;

import java.time.Instant;
import java.util.List;

public record CrawlJobView(
    String jobId,
    CrawlJobStatus status,
    List<String> seedDomains,
    int maxDepth,
    Instant createdAt,
    Instant finishedAt,
    String statusDetail,
    FrontierStats frontier,
    long urlsClaimed,
    long succeeded,
    long failed
) {
}
