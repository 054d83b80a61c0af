package com.schedulinglinks.aggregator.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlUtils {
    private UrlUtils() {
    }

    public static URI parseHttpUrl(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null || uri.getHost().isBlank()) {
                return null;
            }
            String normalizedScheme = scheme.toLowerCase(Locale.ROOT);
            if (!normalizedScheme.equals("http") && !normalizedScheme.equals("https")) {
                return null;
            }
            return uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public static boolean isWellFormedHttpUrl(String value) {
        return parseHttpUrl(value) != null;
    }

    public static String hostOf(String value) {
        URI uri = parseHttpUrl(value);
        if (uri == null) {
            return null;
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }
}
