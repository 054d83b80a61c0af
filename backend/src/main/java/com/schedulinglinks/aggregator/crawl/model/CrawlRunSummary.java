package com.schedulinglinks.aggregator.crawl.model;

import java.time.Instant;
import java.util.List;

public record CrawlRunSummary(
    Instant startedAt,
    Instant finishedAt,
    String status,
    int knownManifests,
    int manifestsNotDue,
    List<ManifestCrawlSummary> manifests,
    CrawlStatsSnapshot stats) {}
