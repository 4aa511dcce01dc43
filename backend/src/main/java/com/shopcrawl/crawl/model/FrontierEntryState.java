package com.shopcrawl.crawl.model;

public enum FrontierEntryState {
    QUEUED,
    IN_FLIGHT,
    DONE,
    RETRYING,
    DEAD
}
