package com.schedulinglinks.aggregator.crawl.model;

import java.time.Instant;

public record LeafFetch(
    Long id,
    FileType fileType,
    String url,
    long manifestFetchId,
    Instant readAt,
    int statusCode,
    Long pollingHintSec,
    String contents,
    String errorCode
) {
    public boolean isSuccessful() {
        return contents != null;
    }
}
