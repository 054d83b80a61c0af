package com.schedulinglinks.aggregator.crawl.manifest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.schedulinglinks.aggregator.crawl.model.FileType;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ManifestOutput(
    @JsonProperty("type") String type,
    @JsonProperty("url") String url,
    @JsonProperty("extension") Extension extension
) {
    public FileType fileType() {
        return FileType.fromManifestType(type);
    }

    public List<String> states() {
        if (extension == null || extension.state() == null) {
            return List.of();
        }
        return extension.state();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Extension(
        @JsonProperty("state") List<String> state
    ) {
    }
}
