package com.schedulinglinks.aggregator.crawl.model;

import java.time.Duration;
import java.time.Instant;

// statusCode is 200 for cache hits and 0 when no response was received
public record ResourceFetchResult(
    String url,
    FetchStatus status,
    int statusCode,
    String body,
    Long pollingHintSec,
    Instant expiresAt,
    String errorCode,
    String errorMessage
) {
    public static final String RATE_LIMITED = "rate_limited";
    public static final String HTTP_STATUS = "http_status";
    public static final String UNEXPECTED_NOT_MODIFIED = "unexpected_not_modified";

    public static ResourceFetchResult cached(ResourceCacheEntry entry, Instant now) {
        long remaining = Math.max(0L, Duration.between(now, entry.expiresAt()).getSeconds());
        return new ResourceFetchResult(entry.url(), FetchStatus.CACHED, 200, entry.body(), remaining, entry.expiresAt(), null, null);
    }

    public static ResourceFetchResult fetched(String url, String body, Long pollingHintSec, Instant expiresAt) {
        return new ResourceFetchResult(url, FetchStatus.FETCHED, 200, body, pollingHintSec, expiresAt, null, null);
    }

    public static ResourceFetchResult notModified(String url, String body, Long pollingHintSec, Instant expiresAt) {
        return new ResourceFetchResult(url, FetchStatus.NOT_MODIFIED, 304, body, pollingHintSec, expiresAt, null, null);
    }

    public static ResourceFetchResult rateLimited(String url, Instant retryAfter) {
        return new ResourceFetchResult(
            url,
            FetchStatus.RATE_LIMITED,
            0,
            null,
            null,
            null,
            RATE_LIMITED,
            "next_attempt_at=" + retryAfter
        );
    }

    public static ResourceFetchResult failed(String url, int statusCode, String errorCode, String errorMessage) {
        return new ResourceFetchResult(url, FetchStatus.FAILED, statusCode, null, null, null, errorCode, errorMessage);
    }

    public boolean isSuccess() {
        return status.hasBody();
    }

    public boolean isRateLimited() {
        return status == FetchStatus.RATE_LIMITED;
    }
}
