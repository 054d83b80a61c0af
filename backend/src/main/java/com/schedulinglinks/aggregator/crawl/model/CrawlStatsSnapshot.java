package com.schedulinglinks.aggregator.crawl.model;

import java.time.Duration;
import java.util.Map;

public record CrawlStatsSnapshot(
    Map<String, Integer> countsByType,
    Map<String, Integer> countsByHost,
    Duration duration
) {}
