package com.schedulinglinks.aggregator.crawl.model;

public record ManifestCrawlSummary(
    long knownManifestId,
    String url,
    String outcome,
    Long manifestFetchId,
    int statusCode,
    int leavesRecorded,
    int leavesFailed,
    int leavesSkipped,
    int jurisdictionTags
) {
    public static final String CRAWLED = "crawled";
    public static final String FETCH_FAILED = "fetch_failed";
    public static final String PARSE_FAILED = "parse_failed";
    public static final String RATE_LIMITED = "rate_limited";
    public static final String ERROR = "error";

    public static ManifestCrawlSummary withoutLeaves(KnownManifest manifest, String outcome, Long manifestFetchId, int statusCode) {
        return new ManifestCrawlSummary(manifest.id(), manifest.url(), outcome, manifestFetchId, statusCode, 0, 0, 0, 0);
    }

    public boolean isCrawled() {
        return CRAWLED.equals(outcome);
    }
}
