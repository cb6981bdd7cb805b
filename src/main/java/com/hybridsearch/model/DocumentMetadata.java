package com.hybridsearch.model;

public record DocumentMetadata(
    int docId,
    String title,
    String url,
    String summary
) {
    public static DocumentMetadata blank(int docId) {
        return new DocumentMetadata(docId, "", "", "");
    }

    public String embeddingText() {
        return ((title == null ? "" : title) + " " + (summary == null ? "" : summary)).trim();
    }
}
