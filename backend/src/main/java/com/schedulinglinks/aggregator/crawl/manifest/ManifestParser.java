package com.schedulinglinks.aggregator.crawl.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class ManifestParser {
    private final ObjectMapper objectMapper;

    public ManifestParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ManifestFile parse(String body) {
        if (body == null || body.isBlank()) {
            throw new ManifestParseException("Manifest body is empty");
        }
        ManifestFile manifest;
        try {
            manifest = objectMapper.readValue(body, ManifestFile.class);
        } catch (JsonProcessingException e) {
            throw new ManifestParseException("Malformed manifest JSON: " + e.getOriginalMessage(), e);
        }
        if (manifest == null) {
            throw new ManifestParseException("Manifest body is JSON null");
        }
        return manifest;
    }
}
