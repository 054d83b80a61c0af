package com.schedulinglinks.aggregator.crawl.model;

import java.time.Instant;

public record FetchAttempt(
    String url,
    Instant fetchAt,
    int statusCode
) {
}
