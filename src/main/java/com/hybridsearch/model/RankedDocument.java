package com.hybridsearch.model;

import java.util.Comparator;

public record RankedDocument(
    int docId,
    double score,
    double lexicalScore,
    double pageRank,
    double semanticScore
) {
    public static final Comparator<RankedDocument> BY_SCORE =
        Comparator.comparingDouble(RankedDocument::score).reversed()
            .thenComparingInt(RankedDocument::docId);
}
