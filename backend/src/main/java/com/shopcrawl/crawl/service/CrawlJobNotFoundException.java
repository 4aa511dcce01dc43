package com.shopcrawl.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class CrawlJobNotFoundException extends RuntimeException {
    public CrawlJobNotFoundException(String jobId) {
        super("Crawl job not found: " + jobId);
    }
}
