package com.schedulinglinks.aggregator.crawl.service;

import com.schedulinglinks.aggregator.config.CrawlerProperties;
import com.schedulinglinks.aggregator.crawl.http.PoliteHttpClient;
import com.schedulinglinks.aggregator.crawl.model.FetchAttempt;
import com.schedulinglinks.aggregator.crawl.model.FetchOptions;
import com.schedulinglinks.aggregator.crawl.model.HttpFetchResult;
import com.schedulinglinks.aggregator.crawl.model.ResourceCacheEntry;
import com.schedulinglinks.aggregator.crawl.model.ResourceFetchResult;
import com.schedulinglinks.aggregator.crawl.persistence.ResourceCacheJdbcRepository;
import com.schedulinglinks.aggregator.crawl.util.CacheHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fetches a URL through the persistent resource cache, honoring the cached expiry, the minimum interval
 * between network attempts and conditional revalidation. All state is re-read from storage on every call;
 * calls on the same URL are serialized so the read-decide-record sequence cannot interleave.
 */
@Service
public class ResourceFetchService {
    private static final Logger log = LoggerFactory.getLogger(ResourceFetchService.class);
    private static final int LOCK_STRIPES = 64;
    private static final String ACCEPT = "application/json, application/fhir+json, application/x-ndjson, */*;q=0.8";

    private final ResourceCacheJdbcRepository repository;
    private final PoliteHttpClient httpClient;
    private final CrawlerProperties properties;
    private final ReentrantLock[] urlLocks = new ReentrantLock[LOCK_STRIPES];

    public ResourceFetchService(
        ResourceCacheJdbcRepository repository,
        PoliteHttpClient httpClient,
        CrawlerProperties properties
    ) {
        this.repository = repository;
        this.httpClient = httpClient;
        this.properties = properties;
        for (int i = 0; i < urlLocks.length; i++) {
            urlLocks[i] = new ReentrantLock();
        }
    }

    public ResourceFetchResult fetch(String url, Instant now, FetchOptions options) {
        if (url == null || url.isBlank()) {
            return ResourceFetchResult.failed(url, 0, PoliteHttpClient.INVALID_URL, "URL is blank");
        }
        FetchOptions safeOptions = options == null ? FetchOptions.defaults() : options;
        Instant fetchTime = now.truncatedTo(ChronoUnit.SECONDS);
        ReentrantLock lock = lockFor(url);
        lock.lock();
        try {
            return fetchLocked(url, fetchTime, safeOptions);
        } finally {
            lock.unlock();
        }
    }

    private ResourceFetchResult fetchLocked(String url, Instant now, FetchOptions options) {
        ResourceCacheEntry cached = options.skipCache() ? null : repository.findCacheEntry(url);
        if (cached != null && cached.isFreshAt(now)) {
            log.debug("Serving {} from cache, fresh until {}", url, cached.expiresAt());
            return ResourceFetchResult.cached(cached, now);
        }

        if (!options.ignoreRateLimiting()) {
            FetchAttempt lastAttempt = repository.findLastFetchAttempt(url);
            Duration window = Duration.ofSeconds(properties.getCache().getRateLimitWindowSeconds());
            if (lastAttempt != null && Duration.between(lastAttempt.fetchAt(), now).compareTo(window) < 0) {
                Instant retryAfter = lastAttempt.fetchAt().plus(window);
                log.debug("Rate limited {}: last attempt at {}, next allowed at {}", url, lastAttempt.fetchAt(), retryAfter);
                return ResourceFetchResult.rateLimited(url, retryAfter);
            }
        }

        HttpFetchResult response = httpClient.get(url, ACCEPT, conditionalHeaders(cached, options), options.userAgent());
        repository.insertFetchAttempt(new FetchAttempt(url, now, response.statusCode()));

        if (response.isTransportError()) {
            return ResourceFetchResult.failed(url, 0, response.errorCode(), response.errorMessage());
        }
        if (response.isNotModified()) {
            return revalidated(url, now, cached, response, options);
        }
        if (response.isOk()) {
            return stored(url, now, response, options);
        }
        return ResourceFetchResult.failed(
            url,
            response.statusCode(),
            ResourceFetchResult.HTTP_STATUS,
            "HTTP " + response.statusCode()
        );
    }

    private ResourceFetchResult revalidated(
        String url,
        Instant now,
        ResourceCacheEntry cached,
        HttpFetchResult response,
        FetchOptions options
    ) {
        if (cached == null) {
            return ResourceFetchResult.failed(
                url,
                response.statusCode(),
                ResourceFetchResult.UNEXPECTED_NOT_MODIFIED,
                "304 received without a cached copy"
            );
        }
        Instant expiresAt = expiresAt(now, response);
        if (!options.suppressCacheWrite()) {
            repository.refreshCacheEntry(url, now, expiresAt);
        }
        return ResourceFetchResult.notModified(url, cached.body(), CacheHeaders.maxAgeSeconds(response.cacheControl()), expiresAt);
    }

    private ResourceFetchResult stored(String url, Instant now, HttpFetchResult response, FetchOptions options) {
        String body = response.body() == null ? "" : response.body();
        Instant expiresAt = expiresAt(now, response);
        if (!options.suppressCacheWrite()) {
            repository.upsertCacheEntry(new ResourceCacheEntry(url, now, expiresAt, response.etag(), body));
        }
        return ResourceFetchResult.fetched(url, body, CacheHeaders.maxAgeSeconds(response.cacheControl()), expiresAt);
    }

    private Instant expiresAt(Instant now, HttpFetchResult response) {
        return CacheHeaders.expiresAt(
            now,
            Duration.ofSeconds(properties.getCache().getDefaultExpirationSeconds()),
            response.expires(),
            response.cacheControl()
        );
    }

    private Map<String, String> conditionalHeaders(ResourceCacheEntry cached, FetchOptions options) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (cached == null) {
            return headers;
        }
        if (!options.suppressIfNoneMatch() && cached.etag() != null && !cached.etag().isBlank()) {
            headers.put("If-None-Match", cached.etag());
        }
        if (!options.suppressIfModifiedSince()) {
            headers.put("If-Modified-Since", CacheHeaders.formatHttpDate(cached.fetchAt()));
        }
        return headers;
    }

    private ReentrantLock lockFor(String url) {
        int hash = url == null ? 0 : url.hashCode();
        return urlLocks[Math.floorMod(hash, urlLocks.length)];
    }
}
