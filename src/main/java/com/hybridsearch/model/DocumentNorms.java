package com.hybridsearch.model;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

public record DocumentNorms(SortedMap<Integer, Double> norms) {
    public DocumentNorms {
        norms = Collections.unmodifiableSortedMap(new TreeMap<>(norms));
    }

    public double normOf(int docId) {
        return norms.getOrDefault(docId, 0.0);
    }
}
