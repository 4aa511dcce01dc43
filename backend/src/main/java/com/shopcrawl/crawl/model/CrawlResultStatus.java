package com.shopcrawl.crawl.model;

public enum CrawlResultStatus {
    SUCCESS,
    FAILURE
}
