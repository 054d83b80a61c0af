package com.schedulinglinks.aggregator.crawl.service;

import com.schedulinglinks.aggregator.config.CrawlerProperties;
import com.schedulinglinks.aggregator.crawl.model.CrawlRunSummary;
import com.schedulinglinks.aggregator.crawl.model.FetchOptions;
import com.schedulinglinks.aggregator.crawl.model.KnownManifest;
import com.schedulinglinks.aggregator.crawl.model.ManifestCrawlSummary;
import com.schedulinglinks.aggregator.crawl.model.ManifestFetch;
import com.schedulinglinks.aggregator.crawl.persistence.CrawlJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);

    public static final String COMPLETED = "COMPLETED";
    public static final String COMPLETED_WITH_ERRORS = "COMPLETED_WITH_ERRORS";

    private final CrawlJdbcRepository repository;
    private final ManifestCrawlerService manifestCrawlerService;
    private final ExecutorService crawlExecutor;
    private final CrawlerProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public CrawlOrchestratorService(
        CrawlJdbcRepository repository,
        ManifestCrawlerService manifestCrawlerService,
        @Qualifier("crawlExecutor") ExecutorService crawlExecutor,
        CrawlerProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.manifestCrawlerService = manifestCrawlerService;
        this.crawlExecutor = crawlExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public CrawlRunSummary run() {
        return run(FetchOptions.defaults());
    }

    /**
     * Crawls every known manifest that is due, in parallel on the crawl executor. Only one run may be
     * active per process.
     *
     * @throws ActiveCrawlRunException when another run is still in progress
     */
    public CrawlRunSummary run(FetchOptions options) {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveCrawlRunException("A crawl run is already in progress");
        }
        try {
            return runExclusive(options);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    // Failed passes count toward polling too.
    public boolean shouldFetchManifest(KnownManifest manifest, Instant now) {
        ManifestFetch last = repository.findLastManifestFetch(manifest.id(), false);
        if (last == null) {
            return true;
        }
        return last.isDueAt(now, defaultPolling());
    }

    private CrawlRunSummary runExclusive(FetchOptions options) {
        CrawlStats stats = new CrawlStats(clock);
        stats.crawlStart();
        Instant startedAt = stats.startedAt();

        List<KnownManifest> knownManifests = repository.findKnownManifests();
        List<KnownManifest> due = new ArrayList<>();
        for (KnownManifest manifest : knownManifests) {
            if (shouldFetchManifest(manifest, startedAt)) {
                due.add(manifest);
            } else {
                log.info("Skipping manifest {}: not due for polling yet", manifest.url());
            }
        }
        log.info("Crawl run started: known_manifests={} due={}", knownManifests.size(), due.size());

        List<CompletableFuture<ManifestCrawlSummary>> futures = new ArrayList<>();
        for (KnownManifest manifest : due) {
            futures.add(CompletableFuture.supplyAsync(
                () -> manifestCrawlerService.crawlManifest(manifest, stats, options),
                crawlExecutor
            ));
        }

        List<ManifestCrawlSummary> summaries = new ArrayList<>();
        boolean hadErrors = false;
        for (int i = 0; i < futures.size(); i++) {
            KnownManifest manifest = due.get(i);
            try {
                ManifestCrawlSummary summary = futures.get(i).join();
                summaries.add(summary);
                if (!summary.isCrawled() && !ManifestCrawlSummary.RATE_LIMITED.equals(summary.outcome())) {
                    hadErrors = true;
                }
            } catch (CompletionException e) {
                hadErrors = true;
                log.warn("Manifest crawl failed for {}", manifest.url(), e.getCause() == null ? e : e.getCause());
                summaries.add(ManifestCrawlSummary.withoutLeaves(manifest, ManifestCrawlSummary.ERROR, null, 0));
            } catch (Exception e) {
                hadErrors = true;
                log.warn("Manifest crawl failed for {}", manifest.url(), e);
                summaries.add(ManifestCrawlSummary.withoutLeaves(manifest, ManifestCrawlSummary.ERROR, null, 0));
            }
        }

        stats.crawlEnd();
        log.info("{}", stats.describe());
        String status = hadErrors ? COMPLETED_WITH_ERRORS : COMPLETED;
        log.info("Crawl run finished with status {} in {}", status, stats.duration());
        return new CrawlRunSummary(
            startedAt,
            stats.endedAt(),
            status,
            knownManifests.size(),
            knownManifests.size() - due.size(),
            summaries,
            stats.snapshot()
        );
    }

    private Duration defaultPolling() {
        return Duration.ofSeconds(properties.getManifest().getDefaultPollingSeconds());
    }
}
