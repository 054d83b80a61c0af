package com.schedulinglinks.aggregator.crawl.model;

public enum FetchStatus {
    CACHED,
    FETCHED,
    NOT_MODIFIED,
    RATE_LIMITED,
    FAILED;

    public boolean hasBody() {
        return this == CACHED || this == FETCHED || this == NOT_MODIFIED;
    }
}
