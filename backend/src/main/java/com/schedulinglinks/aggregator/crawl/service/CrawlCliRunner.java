package com.schedulinglinks.aggregator.crawl.service;

import com.schedulinglinks.aggregator.config.CrawlerProperties;
import com.schedulinglinks.aggregator.crawl.model.CrawlRunSummary;
import com.schedulinglinks.aggregator.crawl.model.ManifestCrawlSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final KnownManifestService knownManifestService;
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        KnownManifestService knownManifestService,
        CrawlOrchestratorService crawlOrchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.knownManifestService = knownManifestService;
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        if (properties.getManifest().isRegisterBeforeCrawl()) {
            knownManifestService.registerConfigured();
        }

        CrawlRunSummary summary = crawlOrchestratorService.run();
        log.info(
            "Crawl run completed with status {}: known={}, not_due={}",
            summary.status(),
            summary.knownManifests(),
            summary.manifestsNotDue()
        );
        for (ManifestCrawlSummary manifest : summary.manifests()) {
            log.info(
                "Summary {}: outcome={}, status={}, leaves={}, failed={}, skipped={}, state_tags={}",
                manifest.url(),
                manifest.outcome(),
                manifest.statusCode(),
                manifest.leavesRecorded(),
                manifest.leavesFailed(),
                manifest.leavesSkipped(),
                manifest.jurisdictionTags()
            );
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
