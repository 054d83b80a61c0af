package com.schedulinglinks.aggregator.crawl.model;

import java.time.Instant;

public record ResourceCacheEntry(
    String url,
    Instant fetchAt,
    Instant expiresAt,
    String etag,
    String body
) {
    public boolean isFreshAt(Instant now) {
        return now.isBefore(expiresAt);
    }
}
