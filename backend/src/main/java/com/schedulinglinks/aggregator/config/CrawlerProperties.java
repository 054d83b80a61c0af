package com.schedulinglinks.aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "scheduling-links-aggregator/0.1 (+crawler)";

    private String userAgent;
    private int globalConcurrency = 4;
    private int perHostConcurrency = 2;
    private int requestTimeoutSeconds = 10;
    private Cache cache = new Cache();
    private Manifest manifest = new Manifest();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getPerHostConcurrency() {
        return Math.max(1, perHostConcurrency);
    }

    public void setPerHostConcurrency(int perHostConcurrency) {
        this.perHostConcurrency = Math.max(1, perHostConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Manifest getManifest() {
        return manifest;
    }

    public void setManifest(Manifest manifest) {
        this.manifest = manifest;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Cache {
        private int defaultExpirationSeconds = 120;
        private int rateLimitWindowSeconds = 90;

        public int getDefaultExpirationSeconds() {
            return Math.max(0, defaultExpirationSeconds);
        }

        public void setDefaultExpirationSeconds(int defaultExpirationSeconds) {
            this.defaultExpirationSeconds = Math.max(0, defaultExpirationSeconds);
        }

        public int getRateLimitWindowSeconds() {
            return Math.max(0, rateLimitWindowSeconds);
        }

        public void setRateLimitWindowSeconds(int rateLimitWindowSeconds) {
            this.rateLimitWindowSeconds = Math.max(0, rateLimitWindowSeconds);
        }
    }

    public static class Manifest {
        private int defaultPollingSeconds = 180;
        private boolean registerBeforeCrawl = true;
        private String urlsFile;
        private List<String> urls = new ArrayList<>();

        public int getDefaultPollingSeconds() {
            return Math.max(1, defaultPollingSeconds);
        }

        public void setDefaultPollingSeconds(int defaultPollingSeconds) {
            this.defaultPollingSeconds = Math.max(1, defaultPollingSeconds);
        }

        public boolean isRegisterBeforeCrawl() {
            return registerBeforeCrawl;
        }

        public void setRegisterBeforeCrawl(boolean registerBeforeCrawl) {
            this.registerBeforeCrawl = registerBeforeCrawl;
        }

        public String getUrlsFile() {
            return urlsFile;
        }

        public void setUrlsFile(String urlsFile) {
            this.urlsFile = urlsFile;
        }

        public List<String> getUrls() {
            return urls;
        }

        public void setUrls(List<String> urls) {
            this.urls = urls == null ? new ArrayList<>() : urls;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
