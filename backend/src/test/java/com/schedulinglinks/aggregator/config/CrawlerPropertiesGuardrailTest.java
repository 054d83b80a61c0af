package com.schedulinglinks.aggregator.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("scheduling-links-aggregator/0.1"));
    }

    @Test
    void concurrencyAndTimeoutAreClamped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setGlobalConcurrency(0);
        properties.setPerHostConcurrency(-3);
        properties.setRequestTimeoutSeconds(0);
        assertEquals(1, properties.getGlobalConcurrency());
        assertEquals(1, properties.getPerHostConcurrency());
        assertEquals(1, properties.getRequestTimeoutSeconds());
    }

    @Test
    void cacheAndPollingDefaults() {
        CrawlerProperties properties = new CrawlerProperties();
        assertEquals(120, properties.getCache().getDefaultExpirationSeconds());
        assertEquals(90, properties.getCache().getRateLimitWindowSeconds());
        assertEquals(180, properties.getManifest().getDefaultPollingSeconds());
        properties.getCache().setRateLimitWindowSeconds(-1);
        assertEquals(0, properties.getCache().getRateLimitWindowSeconds());
    }
}
