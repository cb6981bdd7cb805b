package com.hybridsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PipelineReport(
    String version,
    @JsonProperty("document_count") long documentCount,
    @JsonProperty("parsed_documents") int parsedDocuments,
    @JsonProperty("skipped_documents") int skippedDocuments,
    @JsonProperty("term_count") int termCount,
    @JsonProperty("posting_count") long postingCount,
    int shards,
    @JsonProperty("elapsed_ms") long elapsedMillis
) {}
