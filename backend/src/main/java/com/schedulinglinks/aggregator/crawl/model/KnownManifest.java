package com.schedulinglinks.aggregator.crawl.model;

public record KnownManifest(
    long id,
    String url
) {
}
