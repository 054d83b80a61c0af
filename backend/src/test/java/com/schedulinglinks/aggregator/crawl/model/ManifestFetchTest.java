package com.schedulinglinks.aggregator.crawl.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ManifestFetchTest {
    private static final Instant READ_AT = Instant.parse("2026-03-01T12:00:00Z");
    private static final Duration DEFAULT_POLLING = Duration.ofSeconds(180);

    @Test
    void pollingHintDelaysNextFetch() {
        ManifestFetch fetch = new ManifestFetch(1L, "https://example.org/m", 1L, READ_AT, 200, 300L, "{}", null);

        assertThat(fetch.isDueAt(READ_AT.plusSeconds(299), DEFAULT_POLLING)).isFalse();
        assertThat(fetch.isDueAt(READ_AT.plusSeconds(300), DEFAULT_POLLING)).isTrue();
        assertThat(fetch.isDueAt(READ_AT.plusSeconds(301), DEFAULT_POLLING)).isTrue();
    }

    @Test
    void defaultPollingAppliesWithoutHint() {
        ManifestFetch fetch = new ManifestFetch(1L, "https://example.org/m", 1L, READ_AT, 200, null, "{}", null);

        assertThat(fetch.nextFetchAt(DEFAULT_POLLING)).isEqualTo(READ_AT.plusSeconds(180));
        assertThat(fetch.isDueAt(READ_AT.plusSeconds(179), DEFAULT_POLLING)).isFalse();
    }

    @Test
    void failedPassHasNoContents() {
        ManifestFetch fetch = new ManifestFetch(1L, "https://example.org/m", 1L, READ_AT, 500, null, null, "http_status");

        assertThat(fetch.isSuccessful()).isFalse();
    }
}
