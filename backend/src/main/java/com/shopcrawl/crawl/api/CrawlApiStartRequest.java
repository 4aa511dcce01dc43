package com.shopcrawl.crawl.api;

import java.util.List;

public record CrawlApiStartRequest(
    List<String> domains,
    Integer maxDepth
) {
}
