package com.schedulinglinks.aggregator.crawl.util;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class CacheHeaders {
    // Ten years; larger directives are treated as this value.
    static final long MAX_AGE_CAP_SECONDS = 315_360_000L;
    private static final Pattern MAX_AGE = Pattern.compile("(?:^|[,\\s])max-age\\s*=\\s*\"?(\\d+)\"?", Pattern.CASE_INSENSITIVE);
    private static final DateTimeFormatter HTTP_DATE = DateTimeFormatter
        .ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US)
        .withZone(ZoneOffset.UTC);

    private CacheHeaders() {
    }

    // null when absent
    public static Long maxAgeSeconds(String cacheControl) {
        if (cacheControl == null || cacheControl.isBlank()) {
            return null;
        }
        Matcher matcher = MAX_AGE.matcher(cacheControl);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Math.min(Long.parseLong(matcher.group(1)), MAX_AGE_CAP_SECONDS);
        } catch (NumberFormatException e) {
            // only digits match, so the value overflowed a long
            return MAX_AGE_CAP_SECONDS;
        }
    }

    public static Instant parseHttpDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.from(DateTimeFormatter.RFC_1123_DATE_TIME.parse(value.trim()));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static String formatHttpDate(Instant value) {
        return HTTP_DATE.format(value);
    }

    // Precedence: default offset, then Expires, then max-age. Never before fetchedAt.
    public static Instant expiresAt(Instant fetchedAt, Duration defaultExpiration, String expires, String cacheControl) {
        Instant expiresAt = fetchedAt.plus(defaultExpiration);
        Instant expiresHeader = parseHttpDate(expires);
        if (expiresHeader != null) {
            expiresAt = expiresHeader;
        }
        Long maxAge = maxAgeSeconds(cacheControl);
        if (maxAge != null) {
            expiresAt = fetchedAt.plusSeconds(maxAge);
        }
        return expiresAt.isBefore(fetchedAt) ? fetchedAt : expiresAt;
    }
}
