package com.hybridsearch.model;

import java.util.List;

public record WeightedPostings(
    long documentCount,
    List<TermPostings> terms
) {
    public WeightedPostings {
        terms = List.copyOf(terms);
    }

    public long postingCount() {
        return terms.stream().mapToLong(TermPostings::documentFrequency).sum();
    }
}
