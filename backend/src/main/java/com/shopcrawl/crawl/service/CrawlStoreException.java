package com.shopcrawl.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The shared crawl store could not be read or written. Never a property of the URL being crawled.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class CrawlStoreException extends RuntimeException {
    public CrawlStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
