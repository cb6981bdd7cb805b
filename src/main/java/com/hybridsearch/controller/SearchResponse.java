package com.hybridsearch.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hybridsearch.model.SearchMode;

import java.util.List;

public record SearchResponse(
    List<SearchHit> hits,
    @JsonProperty("search_mode") SearchMode searchMode,
    @JsonProperty("semantic_available") boolean semanticAvailable
) {}
