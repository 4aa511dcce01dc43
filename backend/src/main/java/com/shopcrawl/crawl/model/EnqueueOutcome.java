package com.shopcrawl.crawl.model;

public enum EnqueueOutcome {
    ADMITTED,
    DUPLICATE,
    DEPTH_EXCEEDED,
    OUT_OF_SCOPE,
    INVALID_URL,
    JOB_NOT_RUNNING;

    public boolean isAdmitted() {
        return this == ADMITTED;
    }
}
