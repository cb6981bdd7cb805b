package com.hybridsearch.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SearchHit(
    @JsonProperty("docid") int docId,
    double score,
    String title,
    String url,
    String summary
) {}
