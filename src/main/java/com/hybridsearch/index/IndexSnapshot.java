package com.hybridsearch.index;

import com.hybridsearch.model.TermPostings;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Immutable view of one loaded index version. Queries hold on to the snapshot they started
 * with, so a concurrent reload never changes the data under a running query.
 */
public final class IndexSnapshot {

    private final IndexManifest manifest;
    private final List<InvertedIndexShard> shards;
    private final List<Integer> missingShards;
    private final PageRankTable pageRank;
    private final Map<String, Double> idf;

    public IndexSnapshot(
        IndexManifest manifest,
        List<InvertedIndexShard> shards,
        List<Integer> missingShards,
        PageRankTable pageRank
    ) {
        this.manifest = manifest;
        this.shards = List.copyOf(shards);
        this.missingShards = List.copyOf(missingShards);
        this.pageRank = pageRank;

        Map<String, Double> globalIdf = new HashMap<>();
        for (InvertedIndexShard shard : this.shards) {
            for (TermPostings term : shard.entries().values()) {
                globalIdf.putIfAbsent(term.term(), term.idf());
            }
        }
        this.idf = Map.copyOf(globalIdf);
    }

    public String version() {
        return manifest.version();
    }

    public IndexManifest manifest() {
        return manifest;
    }

    public long documentCount() {
        return manifest.documentCount();
    }

    public List<InvertedIndexShard> shards() {
        return shards;
    }

    public List<Integer> loadedShards() {
        return shards.stream().map(InvertedIndexShard::shardId).toList();
    }

    public List<Integer> missingShards() {
        return missingShards;
    }

    public PageRankTable pageRank() {
        return pageRank;
    }

    public OptionalDouble idf(String term) {
        Double value = idf.get(term);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
