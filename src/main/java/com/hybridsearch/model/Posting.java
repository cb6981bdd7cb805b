package com.hybridsearch.model;

public record Posting(
    int docId,
    int tf,
    double idf,
    double weight
) {
    public static Posting of(int docId, int tf, double idf) {
        return new Posting(docId, tf, idf, tf * idf);
    }
}
