package com.schedulinglinks.aggregator.crawl.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String etag,
    String expires,
    String cacheControl,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isOk() {
        return statusCode == 200 && errorCode == null;
    }

    public boolean isNotModified() {
        return statusCode == 304 && errorCode == null;
    }

    public boolean isTransportError() {
        return errorCode != null;
    }
}
