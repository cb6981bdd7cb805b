package com.hybridsearch.model;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

public record DocumentTermCounts(
    int docId,
    SortedMap<String, Integer> termCounts
) {
    public DocumentTermCounts {
        termCounts = Collections.unmodifiableSortedMap(new TreeMap<>(termCounts));
    }

    public boolean isEmpty() {
        return termCounts.isEmpty();
    }
}
