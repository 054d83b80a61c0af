package com.schedulinglinks.aggregator.crawl.model;

public record FetchOptions(
    boolean skipCache,
    boolean ignoreRateLimiting,
    boolean suppressIfNoneMatch,
    boolean suppressIfModifiedSince,
    boolean suppressCacheWrite,
    String userAgent
) {
    public static FetchOptions defaults() {
        return new FetchOptions(false, false, false, false, false, null);
    }

    public FetchOptions withSkipCache(boolean value) {
        return new FetchOptions(value, ignoreRateLimiting, suppressIfNoneMatch, suppressIfModifiedSince, suppressCacheWrite, userAgent);
    }

    public FetchOptions withIgnoreRateLimiting(boolean value) {
        return new FetchOptions(skipCache, value, suppressIfNoneMatch, suppressIfModifiedSince, suppressCacheWrite, userAgent);
    }

    public FetchOptions withSuppressIfNoneMatch(boolean value) {
        return new FetchOptions(skipCache, ignoreRateLimiting, value, suppressIfModifiedSince, suppressCacheWrite, userAgent);
    }

    public FetchOptions withSuppressIfModifiedSince(boolean value) {
        return new FetchOptions(skipCache, ignoreRateLimiting, suppressIfNoneMatch, value, suppressCacheWrite, userAgent);
    }

    public FetchOptions withSuppressCacheWrite(boolean value) {
        return new FetchOptions(skipCache, ignoreRateLimiting, suppressIfNoneMatch, suppressIfModifiedSince, value, userAgent);
    }

    public FetchOptions withUserAgent(String value) {
        return new FetchOptions(skipCache, ignoreRateLimiting, suppressIfNoneMatch, suppressIfModifiedSince, suppressCacheWrite, value);
    }
}
