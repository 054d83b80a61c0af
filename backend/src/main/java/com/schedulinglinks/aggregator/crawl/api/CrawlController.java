package com.schedulinglinks.aggregator.crawl.api;

import com.schedulinglinks.aggregator.config.CrawlerProperties;
import com.schedulinglinks.aggregator.crawl.model.CrawlRunSummary;
import com.schedulinglinks.aggregator.crawl.model.FetchOptions;
import com.schedulinglinks.aggregator.crawl.model.KnownManifest;
import com.schedulinglinks.aggregator.crawl.model.StatusResponse;
import com.schedulinglinks.aggregator.crawl.service.CrawlOrchestratorService;
import com.schedulinglinks.aggregator.crawl.service.CrawlStatusService;
import com.schedulinglinks.aggregator.crawl.service.KnownManifestService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class CrawlController {
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final KnownManifestService knownManifestService;
    private final CrawlStatusService crawlStatusService;
    private final CrawlerProperties crawlerProperties;

    public CrawlController(
        CrawlOrchestratorService crawlOrchestratorService,
        KnownManifestService knownManifestService,
        CrawlStatusService crawlStatusService,
        CrawlerProperties crawlerProperties
    ) {
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.knownManifestService = knownManifestService;
        this.crawlStatusService = crawlStatusService;
        this.crawlerProperties = crawlerProperties;
    }

    @PostMapping("/crawl/run")
    public CrawlRunSummary runCrawl(@RequestBody(required = false) CrawlApiRunRequest request) {
        boolean registerBeforeCrawl = request == null || request.registerBeforeCrawl() == null
            ? crawlerProperties.getManifest().isRegisterBeforeCrawl()
            : request.registerBeforeCrawl();
        if (registerBeforeCrawl) {
            knownManifestService.registerConfigured();
        }
        FetchOptions options = FetchOptions.defaults();
        if (request != null && Boolean.TRUE.equals(request.ignoreRateLimiting())) {
            options = options.withIgnoreRateLimiting(true);
        }
        if (request != null && Boolean.TRUE.equals(request.skipCache())) {
            options = options.withSkipCache(true);
        }
        return crawlOrchestratorService.run(options);
    }

    @GetMapping("/known-manifests")
    public List<KnownManifest> knownManifests() {
        return knownManifestService.list();
    }

    @PostMapping("/known-manifests")
    @ResponseStatus(HttpStatus.CREATED)
    public KnownManifest registerManifest(@RequestBody KnownManifestRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("url is required");
        }
        return knownManifestService.register(request.url());
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return crawlStatusService.getStatus();
    }
}
