package com.schedulinglinks.aggregator.crawl.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CacheHeadersTest {
    private static final Instant FETCHED_AT = Instant.parse("2026-03-01T12:00:00Z");
    private static final Duration DEFAULT = Duration.ofSeconds(120);

    @Test
    void readsMaxAgeAmongOtherDirectives() {
        assertThat(CacheHeaders.maxAgeSeconds("public, max-age=300, must-revalidate")).isEqualTo(300L);
        assertThat(CacheHeaders.maxAgeSeconds("MAX-AGE=60")).isEqualTo(60L);
        assertThat(CacheHeaders.maxAgeSeconds("s-maxage=60")).isNull();
        assertThat(CacheHeaders.maxAgeSeconds("no-cache")).isNull();
        assertThat(CacheHeaders.maxAgeSeconds(null)).isNull();
    }

    @Test
    void usesDefaultOffsetWithoutHeaders() {
        assertThat(CacheHeaders.expiresAt(FETCHED_AT, DEFAULT, null, null))
            .isEqualTo(FETCHED_AT.plusSeconds(120));
    }

    @Test
    void expiresHeaderOverridesDefault() {
        assertThat(CacheHeaders.expiresAt(FETCHED_AT, DEFAULT, "Sun, 01 Mar 2026 13:00:00 GMT", null))
            .isEqualTo(Instant.parse("2026-03-01T13:00:00Z"));
    }

    @Test
    void maxAgeOverridesExpiresHeader() {
        assertThat(CacheHeaders.expiresAt(FETCHED_AT, DEFAULT, "Sun, 01 Mar 2026 13:00:00 GMT", "max-age=60"))
            .isEqualTo(FETCHED_AT.plusSeconds(60));
    }

    @Test
    void unparseableExpiresIsIgnored() {
        assertThat(CacheHeaders.expiresAt(FETCHED_AT, DEFAULT, "0", null))
            .isEqualTo(FETCHED_AT.plusSeconds(120));
    }

    @Test
    void expiryInThePastIsClampedToFetchTime() {
        assertThat(CacheHeaders.expiresAt(FETCHED_AT, DEFAULT, "Sat, 01 Jan 2000 00:00:00 GMT", null))
            .isEqualTo(FETCHED_AT);
    }

    @Test
    void hugeMaxAgeIsCappedAtTenYears() {
        assertThat(CacheHeaders.maxAgeSeconds("max-age=100000000000000000")).isEqualTo(315_360_000L);
        assertThat(CacheHeaders.maxAgeSeconds("max-age=99999999999999999999999")).isEqualTo(315_360_000L);
        assertThat(CacheHeaders.expiresAt(FETCHED_AT, DEFAULT, null, "public, max-age=100000000000000000"))
            .isEqualTo(FETCHED_AT.plusSeconds(315_360_000L));
    }

    @Test
    void formatsHttpDateThatParsesBack() {
        String formatted = CacheHeaders.formatHttpDate(FETCHED_AT);
        assertThat(formatted).isEqualTo("Sun, 01 Mar 2026 12:00:00 GMT");
        assertThat(CacheHeaders.parseHttpDate(formatted)).isEqualTo(FETCHED_AT);
    }
}
