package com.hybridsearch.index;

import com.hybridsearch.model.TermPostings;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One partition of the inverted index. Every posting's doc id maps to {@code shardId}; the idf
 * carried by each term is the collection-wide value.
 */
public record InvertedIndexShard(
    int shardId,
    SortedMap<String, TermPostings> entries,
    SortedMap<Integer, Double> norms
) {
    public InvertedIndexShard {
        entries = Collections.unmodifiableSortedMap(new TreeMap<>(entries));
        norms = Collections.unmodifiableSortedMap(new TreeMap<>(norms));
    }

    public static InvertedIndexShard empty(int shardId) {
        return new InvertedIndexShard(shardId, new TreeMap<>(), new TreeMap<>());
    }

    public static int shardOf(int docId, int shards) {
        return Math.floorMod(docId, shards);
    }

    public TermPostings postings(String term) {
        return entries.get(term);
    }

    public double norm(int docId) {
        return norms.getOrDefault(docId, 0.0);
    }

    public int termCount() {
        return entries.size();
    }
}
