package com.hybridsearch.model;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

public record ParsedDocument(
    int docId,
    String url,
    List<String> terms,
    SortedSet<Integer> outlinks
) {
    public ParsedDocument {
        terms = List.copyOf(terms);
        outlinks = Collections.unmodifiableSortedSet(new TreeSet<>(outlinks));
    }
}
