package com.hybridsearch;

import com.hybridsearch.index.IndexManifest;
import com.hybridsearch.index.IndexSnapshot;
import com.hybridsearch.index.InvertedIndexShard;
import com.hybridsearch.index.PageRankTable;
import com.hybridsearch.model.DocumentCount;
import com.hybridsearch.model.DocumentNorms;
import com.hybridsearch.model.ParsedCorpus;
import com.hybridsearch.model.RawDocument;
import com.hybridsearch.model.TermFrequencies;
import com.hybridsearch.model.WeightedPostings;
import com.hybridsearch.pipeline.DocumentCounter;
import com.hybridsearch.pipeline.DocumentNormalizer;
import com.hybridsearch.pipeline.DocumentParser;
import com.hybridsearch.pipeline.IdfJoiner;
import com.hybridsearch.pipeline.IndexSharder;
import com.hybridsearch.pipeline.MapReduceExecutor;
import com.hybridsearch.pipeline.TermFrequencyAggregator;
import com.hybridsearch.text.Tokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Builds small in-memory indexes through the real pipeline stages.
 */
public final class TestIndexes {

    public static final Set<String> STOP_WORDS = Set.of("the", "a", "an", "and", "of", "is", "to");

    private TestIndexes() {
    }

    public static Tokenizer tokenizer() {
        return new Tokenizer(STOP_WORDS, false);
    }

    public static String page(int docId, String body) {
        return "<!DOCTYPE html><html><head><meta docid=\"" + docId + "\"></head><body>" + body + "</body></html>";
    }

    public static String page(int docId, String url, String body, String... links) {
        StringBuilder html = new StringBuilder("<!DOCTYPE html><html><head><meta docid=\"")
            .append(docId).append("\"><link rel=\"canonical\" href=\"").append(url).append("\"></head><body><p>")
            .append(body).append("</p>");
        for (String link : links) {
            html.append("<a href=\"").append(link).append("\">link</a>");
        }
        return html.append("</body></html>").toString();
    }

    public static List<RawDocument> crawl(Map<Integer, String> bodies) {
        List<RawDocument> crawl = new ArrayList<>();
        int ordinal = 0;
        for (Map.Entry<Integer, String> entry : new TreeMap<>(bodies).entrySet()) {
            crawl.add(new RawDocument("test.html", ordinal++, page(entry.getKey(), entry.getValue())));
        }
        return crawl;
    }

    public static IndexSnapshot snapshot(Map<Integer, String> bodies, int shardCount, PageRankTable pageRank) {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            MapReduceExecutor mapReduce = new MapReduceExecutor(pool, 2);
            List<RawDocument> crawl = crawl(bodies);

            DocumentCount count = new DocumentCounter(mapReduce).count(crawl);
            ParsedCorpus corpus = new DocumentParser(mapReduce, tokenizer(), "docid").parse(crawl);
            TermFrequencies termFrequencies = new TermFrequencyAggregator(mapReduce).aggregate(corpus);
            WeightedPostings weighted = new IdfJoiner(mapReduce).join(count, termFrequencies);
            DocumentNorms norms = new DocumentNormalizer(mapReduce).normalize(termFrequencies, weighted);
            List<InvertedIndexShard> shards = new IndexSharder(mapReduce).shard(weighted, norms, shardCount);

            IndexManifest manifest = new IndexManifest("test", shardCount, count.value(), weighted.terms().size(), false);
            return new IndexSnapshot(manifest, shards, List.of(), pageRank);
        } finally {
            pool.shutdownNow();
        }
    }
}
