package com.schedulinglinks.aggregator.crawl.manifest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ManifestFile(
    @JsonProperty("transactionTime") String transactionTime,
    @JsonProperty("request") String request,
    @JsonProperty("output") List<ManifestOutput> output
) {
    public List<ManifestOutput> outputs() {
        return output == null ? List.of() : output;
    }
}
