package com.schedulinglinks.aggregator.crawl.model;

import java.time.Duration;
import java.time.Instant;

// contents is null when the pass failed
public record ManifestFetch(
    Long id,
    String url,
    long knownManifestId,
    Instant readAt,
    int statusCode,
    Long pollingHintSec,
    String contents,
    String errorCode
) {
    public boolean isSuccessful() {
        return contents != null;
    }

    public Instant nextFetchAt(Duration defaultPolling) {
        Duration interval = pollingHintSec == null ? defaultPolling : Duration.ofSeconds(pollingHintSec);
        return readAt.plus(interval);
    }

    public boolean isDueAt(Instant now, Duration defaultPolling) {
        return !nextFetchAt(defaultPolling).isAfter(now);
    }
}
