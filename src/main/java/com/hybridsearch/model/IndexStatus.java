package com.hybridsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record IndexStatus(
    boolean loaded,
    String version,
    @JsonProperty("document_count") long documentCount,
    @JsonProperty("loaded_shards") List<Integer> loadedShards,
    @JsonProperty("missing_shards") List<Integer> missingShards,
    @JsonProperty("semantic_available") boolean semanticAvailable,
    @JsonProperty("semantic_reason") String semanticReason
) {}
