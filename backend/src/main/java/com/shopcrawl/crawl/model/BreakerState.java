package com.shopcrawl.crawl.model;

public enum BreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
