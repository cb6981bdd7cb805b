package com.hybridsearch.model;

import java.util.List;

public record TermFrequencies(List<DocumentTermCounts> documents) {
    public TermFrequencies {
        documents = List.copyOf(documents);
    }
}
