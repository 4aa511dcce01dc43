package com.shopcrawl.crawl.model;

public record WorkerPoolStatusResponse(
    boolean running,
    int workerCount,
    int activeFetches,
    long processedCount
) {
}
