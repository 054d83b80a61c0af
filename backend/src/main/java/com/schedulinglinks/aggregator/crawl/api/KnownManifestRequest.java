package com.schedulinglinks.aggregator.crawl.api;

public record KnownManifestRequest(String url) {
}
