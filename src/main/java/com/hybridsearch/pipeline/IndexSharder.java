package com.hybridsearch.pipeline;

import com.hybridsearch.index.InvertedIndexShard;
import com.hybridsearch.model.DocumentNorms;
import com.hybridsearch.model.Posting;
import com.hybridsearch.model.TermPostings;
import com.hybridsearch.model.WeightedPostings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * Partitions weighted postings by {@code floorMod(docId, shards)}. Every shard id in
 * {@code [0, shards)} is produced, even when it receives no postings.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndexSharder {

    private record ShardPosting(String term, double idf, Posting posting) {}

    private final MapReduceExecutor mapReduce;

    public List<InvertedIndexShard> shard(WeightedPostings weighted, DocumentNorms norms, int shards) {
        PipelineStage.INDEX_SHARDER.requireOutputOf(PipelineStage.IDF_JOINER, weighted);
        PipelineStage.INDEX_SHARDER.requireOutputOf(PipelineStage.DOCUMENT_NORMALIZER, norms);
        if (shards < 1) {
            throw new IllegalArgumentException("Shard count must be positive, got " + shards);
        }

        List<InvertedIndexShard> built = mapReduce.run("index-sharder", weighted.terms(),
            (TermPostings term, BiConsumer<Integer, ShardPosting> emit) -> {
                for (Posting posting : term.postings()) {
                    emit.accept(InvertedIndexShard.shardOf(posting.docId(), shards),
                        new ShardPosting(term.term(), term.idf(), posting));
                }
            },
            (Integer shardId, List<ShardPosting> postings) -> assemble(shardId, postings, norms));

        List<InvertedIndexShard> result = new ArrayList<>(shards);
        for (int shardId = 0; shardId < shards; shardId++) {
            result.add(InvertedIndexShard.empty(shardId));
        }
        for (InvertedIndexShard shard : built) {
            result.set(shard.shardId(), shard);
        }

        for (InvertedIndexShard shard : result) {
            log.info("Shard {}: {} terms, {} documents", shard.shardId(), shard.termCount(), shard.norms().size());
        }
        return result;
    }

    private InvertedIndexShard assemble(int shardId, List<ShardPosting> postings, DocumentNorms norms) {
        Map<String, List<Posting>> byTerm = new TreeMap<>();
        Map<String, Double> idfByTerm = new TreeMap<>();
        SortedMap<Integer, Double> shardNorms = new TreeMap<>();

        for (ShardPosting sp : postings) {
            byTerm.computeIfAbsent(sp.term(), t -> new ArrayList<>()).add(sp.posting());
            idfByTerm.put(sp.term(), sp.idf());
            shardNorms.put(sp.posting().docId(), norms.normOf(sp.posting().docId()));
        }

        SortedMap<String, TermPostings> entries = new TreeMap<>();
        for (Map.Entry<String, List<Posting>> entry : byTerm.entrySet()) {
            List<Posting> list = entry.getValue();
            list.sort(Comparator.comparingInt(Posting::docId));
            entries.put(entry.getKey(), new TermPostings(entry.getKey(), idfByTerm.get(entry.getKey()), list));
        }
        return new InvertedIndexShard(shardId, entries, shardNorms);
    }
}
