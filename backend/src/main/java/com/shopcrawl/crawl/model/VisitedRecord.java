package com.shopcrawl.crawl.model;

import java.time.Instant;

public record VisitedRecord(String jobId, String url, int firstDepth, Instant firstSeenAt) {}
