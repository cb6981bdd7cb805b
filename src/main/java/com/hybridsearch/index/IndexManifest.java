package com.hybridsearch.index;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IndexManifest(
    @JsonProperty("version") String version,
    @JsonProperty("shards") int shards,
    @JsonProperty("document_count") long documentCount,
    @JsonProperty("term_count") int termCount,
    @JsonProperty("stemming") boolean stemming
) {}
