package com.shopcrawl.crawl.model;

public record LeaseRecoverySummary(int examined, int requeued, int dead) {}
