package com.schedulinglinks.aggregator.crawl.service;

import com.schedulinglinks.aggregator.config.CrawlerProperties;
import com.schedulinglinks.aggregator.crawl.model.KnownManifest;
import com.schedulinglinks.aggregator.crawl.persistence.CrawlJdbcRepository;
import com.schedulinglinks.aggregator.crawl.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
public class KnownManifestService {
    private static final Logger log = LoggerFactory.getLogger(KnownManifestService.class);

    private final CrawlJdbcRepository repository;
    private final CrawlerProperties properties;

    public KnownManifestService(CrawlJdbcRepository repository, CrawlerProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    public List<KnownManifest> list() {
        return repository.findKnownManifests();
    }

    public KnownManifest register(String url) {
        if (!UrlUtils.isWellFormedHttpUrl(url)) {
            throw new IllegalArgumentException("Not a valid manifest URL: " + url);
        }
        return repository.insertKnownManifestIfAbsent(url.trim());
    }

    public List<KnownManifest> registerConfigured() {
        Set<String> candidates = new LinkedHashSet<>();
        for (String url : properties.getManifest().getUrls()) {
            if (url != null && !url.isBlank()) {
                candidates.add(url.trim());
            }
        }
        candidates.addAll(readUrlsFile());

        List<KnownManifest> registered = new ArrayList<>();
        for (String url : candidates) {
            try {
                registered.add(register(url));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping configured manifest: {}", e.getMessage());
            }
        }
        if (!registered.isEmpty()) {
            log.info("Registered {} configured manifest(s)", registered.size());
        }
        return registered;
    }

    private List<String> readUrlsFile() {
        String configured = properties.getManifest().getUrlsFile();
        if (configured == null || configured.isBlank()) {
            return List.of();
        }
        Path path = resolvePath(configured);
        if (!Files.isRegularFile(path)) {
            log.warn("Manifest URL file not found: {}", path);
            return List.of();
        }
        List<String> urls = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                urls.add(trimmed);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read manifest URL file " + path, e);
        }
        return urls;
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
