package com.schedulinglinks.aggregator.crawl.service;

import com.schedulinglinks.aggregator.crawl.manifest.ManifestFile;
import com.schedulinglinks.aggregator.crawl.manifest.ManifestOutput;
import com.schedulinglinks.aggregator.crawl.manifest.ManifestParseException;
import com.schedulinglinks.aggregator.crawl.manifest.ManifestParser;
import com.schedulinglinks.aggregator.crawl.model.FetchOptions;
import com.schedulinglinks.aggregator.crawl.model.FileType;
import com.schedulinglinks.aggregator.crawl.model.KnownManifest;
import com.schedulinglinks.aggregator.crawl.model.LeafFetch;
import com.schedulinglinks.aggregator.crawl.model.ManifestCrawlSummary;
import com.schedulinglinks.aggregator.crawl.model.ManifestFetch;
import com.schedulinglinks.aggregator.crawl.model.ResourceFetchResult;
import com.schedulinglinks.aggregator.crawl.model.UsState;
import com.schedulinglinks.aggregator.crawl.persistence.CrawlJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class ManifestCrawlerService {
    private static final Logger log = LoggerFactory.getLogger(ManifestCrawlerService.class);

    private final ResourceFetchService resourceFetchService;
    private final ManifestParser manifestParser;
    private final CrawlJdbcRepository repository;
    private final Clock clock;

    public ManifestCrawlerService(
        ResourceFetchService resourceFetchService,
        ManifestParser manifestParser,
        CrawlJdbcRepository repository,
        Clock clock
    ) {
        this.resourceFetchService = resourceFetchService;
        this.manifestParser = manifestParser;
        this.repository = repository;
        this.clock = clock;
    }

    public ManifestCrawlSummary crawlManifest(KnownManifest manifest, CrawlStats stats, FetchOptions options) {
        String manifestUrl = manifest.url();
        log.info("Crawling manifest file: {}", manifestUrl);
        stats.record(manifestUrl, CrawlStats.MANIFEST);
        Instant readAt = clock.instant();
        ResourceFetchResult result = resourceFetchService.fetch(manifestUrl, readAt, options);

        if (result.isRateLimited()) {
            log.info("Skipping manifest {} this pass: {}", manifestUrl, result.errorMessage());
            return ManifestCrawlSummary.withoutLeaves(manifest, ManifestCrawlSummary.RATE_LIMITED, null, 0);
        }
        if (!result.isSuccess()) {
            log.warn(
                "Failed to fetch manifest {}: status={} error={} {}",
                manifestUrl,
                result.statusCode(),
                result.errorCode(),
                result.errorMessage()
            );
            long manifestFetchId = repository.insertManifestFetch(failedManifestFetch(manifest, readAt, result, result.errorCode()));
            return ManifestCrawlSummary.withoutLeaves(manifest, ManifestCrawlSummary.FETCH_FAILED, manifestFetchId, result.statusCode());
        }

        ManifestFile manifestFile;
        try {
            manifestFile = manifestParser.parse(result.body());
        } catch (ManifestParseException e) {
            log.warn("Failed to parse manifest {}: {}", manifestUrl, e.getMessage());
            long manifestFetchId = repository.insertManifestFetch(failedManifestFetch(manifest, readAt, result, ManifestCrawlSummary.PARSE_FAILED));
            return ManifestCrawlSummary.withoutLeaves(manifest, ManifestCrawlSummary.PARSE_FAILED, manifestFetchId, result.statusCode());
        }

        long manifestFetchId = repository.insertManifestFetch(new ManifestFetch(
            null,
            manifestUrl,
            manifest.id(),
            readAt,
            result.statusCode(),
            result.pollingHintSec(),
            result.body(),
            null
        ));

        int recorded = 0;
        int failed = 0;
        int skipped = 0;
        int tags = 0;
        for (ManifestOutput output : manifestFile.outputs()) {
            FileType fileType = output.fileType();
            switch (fileType) {
                case LOCATION, SCHEDULE, SLOT -> {
                    if (output.url() == null || output.url().isBlank()) {
                        log.warn("Skipping {} output without url in manifest {}", fileType.manifestType(), manifestUrl);
                        skipped++;
                        continue;
                    }
                    try {
                        LeafOutcome outcome = crawlLeaf(fileType, output, manifestFetchId, stats, options);
                        if (outcome.recorded()) {
                            recorded++;
                            tags += outcome.tags();
                            if (!outcome.successful()) {
                                failed++;
                            }
                        } else {
                            skipped++;
                        }
                    } catch (RuntimeException e) {
                        failed++;
                        log.warn("Unable to crawl {} file {}", fileType.manifestType(), output.url(), e);
                    }
                }
                case UNSUPPORTED -> {
                    skipped++;
                    log.warn("Unknown output file type '{}' specified in manifest {}", output.type(), manifestUrl);
                }
            }
        }

        log.info(
            "Manifest {} crawled: leaves_recorded={} leaves_failed={} leaves_skipped={} state_tags={}",
            manifestUrl,
            recorded,
            failed,
            skipped,
            tags
        );
        return new ManifestCrawlSummary(
            manifest.id(),
            manifestUrl,
            ManifestCrawlSummary.CRAWLED,
            manifestFetchId,
            result.statusCode(),
            recorded,
            failed,
            skipped,
            tags
        );
    }

    private LeafOutcome crawlLeaf(
        FileType fileType,
        ManifestOutput output,
        long manifestFetchId,
        CrawlStats stats,
        FetchOptions options
    ) {
        String url = output.url();
        log.debug("Crawling {} file: {}", fileType.manifestType(), url);
        stats.record(url, fileType.statsKey());
        Instant readAt = clock.instant();
        ResourceFetchResult result = resourceFetchService.fetch(url, readAt, options);
        if (result.isRateLimited()) {
            log.info("Skipping {} file {} this pass: {}", fileType.manifestType(), url, result.errorMessage());
            return new LeafOutcome(false, false, 0);
        }
        if (!result.isSuccess()) {
            log.warn(
                "Unable to crawl {} file {}: status={} error={} {}",
                fileType.manifestType(),
                url,
                result.statusCode(),
                result.errorCode(),
                result.errorMessage()
            );
        }

        List<UsState> states = jurisdictions(output, url);
        LeafFetch fetch = new LeafFetch(
            null,
            fileType,
            url,
            manifestFetchId,
            readAt,
            result.statusCode(),
            result.pollingHintSec(),
            result.isSuccess() ? result.body() : null,
            result.isSuccess() ? null : result.errorCode()
        );
        repository.recordLeafFetch(fetch, states);
        return new LeafOutcome(true, result.isSuccess(), states.size());
    }

    private List<UsState> jurisdictions(ManifestOutput output, String url) {
        List<UsState> states = new ArrayList<>();
        for (String code : output.states()) {
            Optional<UsState> state = UsState.fromCode(code);
            if (state.isEmpty()) {
                log.warn("Failed to find state id for '{}' on {}", code, url);
                continue;
            }
            if (!states.contains(state.get())) {
                states.add(state.get());
            }
        }
        return states;
    }

    private ManifestFetch failedManifestFetch(KnownManifest manifest, Instant readAt, ResourceFetchResult result, String errorCode) {
        return new ManifestFetch(
            null,
            manifest.url(),
            manifest.id(),
            readAt,
            result.statusCode(),
            result.pollingHintSec(),
            null,
            errorCode
        );
    }

    private record LeafOutcome(boolean recorded, boolean successful, int tags) {
    }
}
