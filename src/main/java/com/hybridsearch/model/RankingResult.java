package com.hybridsearch.model;

import java.util.List;

public record RankingResult(
    List<RankedDocument> documents,
    SearchMode searchMode,
    boolean semanticAvailable
) {
    public RankingResult {
        documents = List.copyOf(documents);
    }

    public static RankingResult empty(SearchMode mode, boolean semanticAvailable) {
        return new RankingResult(List.of(), mode, semanticAvailable);
    }
}
