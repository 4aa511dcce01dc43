package com.shopcrawl.crawl.model;

public record WorkUnit(String jobId, String url, int depth, String domain, int attempt) {}
