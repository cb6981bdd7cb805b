package com.hybridsearch.model;

import java.util.List;

public record ParsedCorpus(
    List<ParsedDocument> documents,
    int skippedDocuments
) {
    public ParsedCorpus {
        documents = List.copyOf(documents);
    }
}
