package com.schedulinglinks.aggregator.crawl.api;

public record CrawlApiRunRequest(
    Boolean registerBeforeCrawl,
    Boolean ignoreRateLimiting,
    Boolean skipCache
) {
}
