package com.schedulinglinks.aggregator.crawl.service;

import com.schedulinglinks.aggregator.crawl.model.CrawlStatsSnapshot;
import com.schedulinglinks.aggregator.crawl.util.UrlUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

public class CrawlStats {
    public static final String MANIFEST = "manifest";

    private final Clock clock;
    private final Map<String, Integer> countsByType = new TreeMap<>();
    private final Map<String, Integer> countsByHost = new TreeMap<>();
    private Instant startedAt;
    private Instant endedAt;

    public CrawlStats(Clock clock) {
        this.clock = clock;
    }

    public synchronized void crawlStart() {
        startedAt = clock.instant();
    }

    public synchronized void crawlEnd() {
        endedAt = clock.instant();
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized Instant endedAt() {
        return endedAt;
    }

    public synchronized void record(String url, String type) {
        String key = type == null ? "unknown" : type.toLowerCase(Locale.ROOT);
        countsByType.merge(key, 1, Integer::sum);
        String host = UrlUtils.hostOf(url);
        if (host != null) {
            countsByHost.merge(host, 1, Integer::sum);
        }
    }

    public synchronized int countForType(String type) {
        return countsByType.getOrDefault(type.toLowerCase(Locale.ROOT), 0);
    }

    public synchronized int countForHost(String host) {
        return countsByHost.getOrDefault(host.toLowerCase(Locale.ROOT), 0);
    }

    public synchronized Duration duration() {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        Instant end = endedAt == null ? clock.instant() : endedAt;
        return Duration.between(startedAt, end);
    }

    public synchronized CrawlStatsSnapshot snapshot() {
        return new CrawlStatsSnapshot(Map.copyOf(countsByType), Map.copyOf(countsByHost), duration());
    }

    public synchronized String describe() {
        StringBuilder out = new StringBuilder();
        out.append("Crawling took ").append(duration()).append(".\n");
        out.append("Crawled resources by type:\n");
        countsByType.forEach((type, count) -> out.append("  ").append(type).append(": ").append(count).append('\n'));
        out.append("Crawled resources by host:\n");
        countsByHost.forEach((host, count) -> out.append("  ").append(host).append(": ").append(count).append('\n'));
        return out.toString();
    }
}
