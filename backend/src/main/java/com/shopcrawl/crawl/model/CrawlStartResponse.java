package com.shopcrawl.crawl.model;

public record CrawlStartResponse(String jobId, CrawlJobStatus status) {}
