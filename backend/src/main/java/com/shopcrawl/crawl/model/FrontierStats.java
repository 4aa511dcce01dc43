package com.shopcrawl.crawl.model;

public record FrontierStats(long queued, long inFlight, long retrying) {
    public long live() {
        return queued + inFlight + retrying;
    }
}
