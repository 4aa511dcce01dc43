package com.shopcrawl.crawl.model;

public enum CrawlJobStatus {
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
