package com.schedulinglinks.aggregator.crawl.service;

import com.schedulinglinks.aggregator.crawl.model.FetchAttempt;
import com.schedulinglinks.aggregator.crawl.model.FetchOptions;
import com.schedulinglinks.aggregator.crawl.model.FileType;
import com.schedulinglinks.aggregator.crawl.model.KnownManifest;
import com.schedulinglinks.aggregator.crawl.model.LeafFetch;
import com.schedulinglinks.aggregator.crawl.model.ManifestCrawlSummary;
import com.schedulinglinks.aggregator.crawl.model.ManifestFetch;
import com.schedulinglinks.aggregator.crawl.model.ResourceFetchResult;
import com.schedulinglinks.aggregator.crawl.persistence.CrawlJdbcRepository;
import com.schedulinglinks.aggregator.crawl.persistence.ResourceCacheJdbcRepository;
import com.schedulinglinks.aggregator.crawl.util.CacheHeaders;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ManifestCrawlerServiceTest {

    @Autowired
    private ManifestCrawlerService service;

    @Autowired
    private CrawlJdbcRepository repository;

    @Autowired
    private ResourceCacheJdbcRepository cacheRepository;

    private MockWebServer server;
    private final Map<String, MockResponse> responses = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                MockResponse response = responses.get(request.getPath());
                return response == null ? new MockResponse().setResponseCode(404) : response;
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void recordsEveryLeafEvenWhenOneFails() {
        responses.put("/manifest.json", json("""
            {
              "transactionTime": "2026-03-01T12:00:00Z",
              "request": "%s",
              "output": [
                {"type": "Location", "url": "%s", "extension": {"state": ["MA", "ZZ"]}},
                {"type": "Location", "url": "%s"},
                {"type": "Schedule", "url": "%s", "extension": {"state": ["ri"]}},
                {"type": "Slot", "url": "%s"},
                {"type": "PractitionerRole", "url": "%s"}
              ]
            }
            """.formatted(
            url("/$bulk-publish"),
            url("/locations-1.ndjson"),
            url("/locations-2.ndjson"),
            url("/schedules.ndjson"),
            url("/slots.ndjson"),
            url("/roles.ndjson")
        )));
        responses.put("/locations-1.ndjson", json("{\"resourceType\":\"Location\",\"id\":\"1\"}"));
        responses.put("/locations-2.ndjson", json("{\"resourceType\":\"Location\",\"id\":\"2\"}"));
        responses.put("/schedules.ndjson", json("{\"resourceType\":\"Schedule\",\"id\":\"s\"}"));
        responses.put("/slots.ndjson", new MockResponse().setResponseCode(500).setBody("boom"));
        KnownManifest manifest = repository.insertKnownManifestIfAbsent(url("/manifest.json"));
        CrawlStats stats = new CrawlStats(Clock.systemUTC());

        ManifestCrawlSummary summary = service.crawlManifest(manifest, stats, FetchOptions.defaults());

        assertThat(summary.outcome()).isEqualTo(ManifestCrawlSummary.CRAWLED);
        assertThat(summary.leavesRecorded()).isEqualTo(4);
        assertThat(summary.leavesFailed()).isEqualTo(1);
        assertThat(summary.leavesSkipped()).isEqualTo(1);
        assertThat(summary.jurisdictionTags()).isEqualTo(2);

        List<ManifestFetch> manifestFetches = repository.findManifestFetches(manifest.id());
        assertThat(manifestFetches).hasSize(1);
        assertThat(manifestFetches.get(0).contents()).contains("Location");
        long manifestFetchId = manifestFetches.get(0).id();
        assertThat(summary.manifestFetchId()).isEqualTo(manifestFetchId);

        List<LeafFetch> locations = repository.findLeafFetches(FileType.LOCATION, manifestFetchId);
        List<LeafFetch> schedules = repository.findLeafFetches(FileType.SCHEDULE, manifestFetchId);
        List<LeafFetch> slots = repository.findLeafFetches(FileType.SLOT, manifestFetchId);
        assertThat(locations).hasSize(2);
        assertThat(schedules).hasSize(1);
        assertThat(slots).hasSize(1);
        assertThat(locations).allSatisfy(fetch -> assertThat(fetch.contents()).isNotNull());
        assertThat(schedules.get(0).contents()).isNotNull();
        assertThat(slots.get(0).contents()).isNull();
        assertThat(slots.get(0).statusCode()).isEqualTo(500);
        assertThat(slots.get(0).errorCode()).isEqualTo(ResourceFetchResult.HTTP_STATUS);

        assertThat(repository.findStateCodes(FileType.LOCATION, locations.get(0).id())).containsExactly("MA");
        assertThat(repository.findStateCodes(FileType.LOCATION, locations.get(1).id())).isEmpty();
        assertThat(repository.findStateCodes(FileType.SCHEDULE, schedules.get(0).id())).containsExactly("RI");

        assertThat(stats.countForType(CrawlStats.MANIFEST)).isEqualTo(1);
        assertThat(stats.countForType("location")).isEqualTo(2);
        assertThat(stats.countForType("slot")).isEqualTo(1);
        assertThat(stats.countForHost(server.getHostName())).isEqualTo(5);
    }

    @Test
    void unparseableManifestIsRecordedAsParseFailure() {
        responses.put("/manifest.json", json("<html>not a manifest</html>"));
        KnownManifest manifest = repository.insertKnownManifestIfAbsent(url("/manifest.json"));

        ManifestCrawlSummary summary = service.crawlManifest(manifest, new CrawlStats(Clock.systemUTC()), FetchOptions.defaults());

        assertThat(summary.outcome()).isEqualTo(ManifestCrawlSummary.PARSE_FAILED);
        List<ManifestFetch> fetches = repository.findManifestFetches(manifest.id());
        assertThat(fetches).hasSize(1);
        assertThat(fetches.get(0).contents()).isNull();
        assertThat(fetches.get(0).statusCode()).isEqualTo(200);
        assertThat(fetches.get(0).errorCode()).isEqualTo("parse_failed");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void missingManifestIsRecordedAsFetchFailure() {
        KnownManifest manifest = repository.insertKnownManifestIfAbsent(url("/missing.json"));

        ManifestCrawlSummary summary = service.crawlManifest(manifest, new CrawlStats(Clock.systemUTC()), FetchOptions.defaults());

        assertThat(summary.outcome()).isEqualTo(ManifestCrawlSummary.FETCH_FAILED);
        assertThat(summary.statusCode()).isEqualTo(404);
        ManifestFetch fetch = repository.findLastManifestFetch(manifest.id(), false);
        assertThat(fetch.contents()).isNull();
        assertThat(fetch.statusCode()).isEqualTo(404);
        assertThat(fetch.errorCode()).isEqualTo(ResourceFetchResult.HTTP_STATUS);
        assertThat(repository.findLastManifestFetch(manifest.id(), true)).isNull();
    }

    @Test
    void pollingHintIsStoredWithManifestFetch() {
        responses.put("/manifest.json", json("{\"output\": []}").setHeader("Cache-Control", "max-age=300"));
        KnownManifest manifest = repository.insertKnownManifestIfAbsent(url("/manifest.json"));

        service.crawlManifest(manifest, new CrawlStats(Clock.systemUTC()), FetchOptions.defaults());

        ManifestFetch fetch = repository.findLastManifestFetch(manifest.id(), true);
        assertThat(fetch.pollingHintSec()).isEqualTo(300L);
    }

    @Test
    void leafWithOversizedMaxAgeIsStillRecorded() {
        responses.put("/manifest.json", json("""
            {"output": [{"type": "Location", "url": "%s", "extension": {"state": ["NY"]}}]}
            """.formatted(url("/locations.ndjson"))));
        responses.put("/locations.ndjson", json("{\"resourceType\":\"Location\",\"id\":\"1\"}")
            .setHeader("Cache-Control", "max-age=100000000000000000"));
        KnownManifest manifest = repository.insertKnownManifestIfAbsent(url("/manifest.json"));

        ManifestCrawlSummary summary = service.crawlManifest(manifest, new CrawlStats(Clock.systemUTC()), FetchOptions.defaults());

        assertThat(summary.leavesRecorded()).isEqualTo(1);
        assertThat(summary.leavesFailed()).isZero();
        List<LeafFetch> locations = repository.findLeafFetches(FileType.LOCATION, summary.manifestFetchId());
        assertThat(locations).hasSize(1);
        assertThat(locations.get(0).contents()).contains("Location");
        assertThat(locations.get(0).pollingHintSec()).isEqualTo(315_360_000L);
        assertThat(repository.findStateCodes(FileType.LOCATION, locations.get(0).id())).containsExactly("NY");
    }

    @Test
    void rateLimitedManifestWritesNoLedgerRow() {
        KnownManifest manifest = repository.insertKnownManifestIfAbsent(url("/manifest.json"));
        cacheRepository.insertFetchAttempt(new FetchAttempt(manifest.url(), Instant.now(), 500));

        ManifestCrawlSummary summary = service.crawlManifest(manifest, new CrawlStats(Clock.systemUTC()), FetchOptions.defaults());

        assertThat(summary.outcome()).isEqualTo(ManifestCrawlSummary.RATE_LIMITED);
        assertThat(summary.manifestFetchId()).isNull();
        assertThat(repository.findManifestFetches(manifest.id())).isEmpty();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void rateLimitedLeafIsSkippedWithoutLedgerRow() {
        String leafUrl = url("/slots.ndjson");
        responses.put("/manifest.json", json("""
            {"output": [{"type": "Slot", "url": "%s"}]}
            """.formatted(leafUrl)));
        responses.put("/slots.ndjson", json("{\"resourceType\":\"Slot\",\"id\":\"1\"}"));
        cacheRepository.insertFetchAttempt(new FetchAttempt(leafUrl, Instant.now(), 500));
        KnownManifest manifest = repository.insertKnownManifestIfAbsent(url("/manifest.json"));

        ManifestCrawlSummary summary = service.crawlManifest(manifest, new CrawlStats(Clock.systemUTC()), FetchOptions.defaults());

        assertThat(summary.outcome()).isEqualTo(ManifestCrawlSummary.CRAWLED);
        assertThat(summary.leavesRecorded()).isZero();
        assertThat(summary.leavesFailed()).isZero();
        assertThat(summary.leavesSkipped()).isEqualTo(1);
        assertThat(repository.findLeafFetches(FileType.SLOT, summary.manifestFetchId())).isEmpty();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void cachedManifestReportsRemainingLifetimeAsPollingHint() {
        String expires = CacheHeaders.formatHttpDate(Instant.now().plusSeconds(3600));
        responses.put("/manifest.json", json("{\"output\": []}").setHeader("Expires", expires));
        KnownManifest manifest = repository.insertKnownManifestIfAbsent(url("/manifest.json"));

        service.crawlManifest(manifest, new CrawlStats(Clock.systemUTC()), FetchOptions.defaults());
        service.crawlManifest(manifest, new CrawlStats(Clock.systemUTC()), FetchOptions.defaults());

        List<ManifestFetch> fetches = repository.findManifestFetches(manifest.id());
        assertThat(fetches).hasSize(2);
        assertThat(fetches).anySatisfy(fetch -> assertThat(fetch.pollingHintSec()).isNull());
        assertThat(fetches).anySatisfy(fetch -> assertThat(fetch.pollingHintSec()).isBetween(3500L, 3600L));
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    private MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    private String url(String path) {
        return server.url(path).toString();
    }
}
