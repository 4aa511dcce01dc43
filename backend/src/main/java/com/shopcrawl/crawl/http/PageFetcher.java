package com.shopcrawl.crawl.http;

import com.shopcrawl.crawl.model.HttpFetchResult;

/**
 * Fetches one page. Transport problems come back as {@link HttpFetchResult#errorCode()}, never as exceptions.
 */
public interface PageFetcher {
    HttpFetchResult fetch(String url);
}
