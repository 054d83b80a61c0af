package com.schedulinglinks.aggregator.crawl.model;

import java.time.Instant;
import java.util.Map;

public record StatusResponse(
    Instant checkedAt,
    boolean dbReachable,
    Map<String, Long> tableCounts
) {}
