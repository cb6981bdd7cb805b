package com.hybridsearch.model;

import java.util.List;

/**
 * All postings of one term, ordered by doc id. Every posting carries the same global idf.
 */
public record TermPostings(
    String term,
    double idf,
    List<Posting> postings
) {
    public TermPostings {
        postings = List.copyOf(postings);
    }

    public int documentFrequency() {
        return postings.size();
    }
}
