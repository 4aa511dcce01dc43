package com.shopcrawl.crawl.model;

import java.time.Instant;
import java.util.List;

public record CrawlJob(
    String id,
    List<String> seedDomains,
    int maxDepth,
    CrawlJobStatus status,
    Instant createdAt,
    Instant finishedAt,
    String statusDetail
) {
    public boolean isRunning() {
        return status == CrawlJobStatus.RUNNING;
    }
}
