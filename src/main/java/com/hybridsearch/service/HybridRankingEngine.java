package com.hybridsearch.service;

import com.hybridsearch.config.RankingProperties;
import com.hybridsearch.index.IndexHolder;
import com.hybridsearch.index.IndexSnapshot;
import com.hybridsearch.index.InvertedIndexShard;
import com.hybridsearch.model.Posting;
import com.hybridsearch.model.RankedDocument;
import com.hybridsearch.model.RankingResult;
import com.hybridsearch.model.SearchMode;
import com.hybridsearch.model.SemanticCandidatePolicy;
import com.hybridsearch.model.SemanticCapability;
import com.hybridsearch.model.SimilarDocument;
import com.hybridsearch.model.TermPostings;
import com.hybridsearch.repository.DocumentEmbeddingRepository;
import com.hybridsearch.text.Tokenizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Scores every shard of the current snapshot against the query and blends lexical relevance,
 * PageRank and, when available, embedding similarity:
 * <ul>
 *   <li>lexical: {@code sum(q_w * d_w) / (|q| * norm_d)}, 0 when either norm is 0</li>
 *   <li>traditional: {@code (1 - w) * lexical + w * pagerank}</li>
 *   <li>semantic: clamped cosine similarity of query and document embeddings</li>
 *   <li>hybrid: {@code (1 - alpha) * traditional + alpha * semantic}</li>
 * </ul>
 * Results are ordered by score descending, then doc id ascending.
 */
@Slf4j
@Service
public class HybridRankingEngine implements RankingEngine {

    private record ShardMatches(Map<Integer, Double> lexical, Set<Integer> overlap) {}

    private record LexicalMatches(SortedMap<Integer, Double> lexical, SortedSet<Integer> overlap) {}

    private final Tokenizer tokenizer;
    private final IndexHolder indexHolder;
    private final SemanticCapabilityProvider capabilityProvider;
    private final EmbeddingService embeddingService;
    private final DocumentEmbeddingRepository embeddingRepository;
    private final RankingProperties properties;
    private final AsyncTaskExecutor semanticExecutor;

    public HybridRankingEngine(
        Tokenizer tokenizer,
        IndexHolder indexHolder,
        SemanticCapabilityProvider capabilityProvider,
        EmbeddingService embeddingService,
        DocumentEmbeddingRepository embeddingRepository,
        RankingProperties properties,
        @Qualifier("semanticQueryExecutor") AsyncTaskExecutor semanticExecutor
    ) {
        this.tokenizer = tokenizer;
        this.indexHolder = indexHolder;
        this.capabilityProvider = capabilityProvider;
        this.embeddingService = embeddingService;
        this.embeddingRepository = embeddingRepository;
        this.properties = properties;
        this.semanticExecutor = semanticExecutor;
    }

    @Override
    public RankingResult rank(String query, double pagerankWeight, SearchMode mode) {
        if (Double.isNaN(pagerankWeight) || pagerankWeight < 0.0 || pagerankWeight > 1.0) {
            throw new IllegalArgumentException("PageRank weight must be in [0, 1], got " + pagerankWeight);
        }
        SearchMode requested = mode == null ? SearchMode.TRADITIONAL : mode;
        IndexSnapshot index = indexHolder.current();
        SemanticCapability capability = capabilityProvider.current();

        List<String> terms = tokenizer.tokenize(query);
        SortedMap<String, Double> queryWeights = queryWeights(terms, index);
        if (queryWeights.isEmpty()) {
            log.debug("Query '{}' has no indexed terms", query);
            return RankingResult.empty(requested.usesSemantic() && capability.available()
                ? requested : SearchMode.TRADITIONAL, capability.available());
        }

        LexicalMatches matches = match(index, queryWeights);
        Map<Integer, RankedDocument> traditional = traditional(index, matches, pagerankWeight);

        log.debug("Query '{}': terms={}, indexed={}, lexical candidates={}, overlap={}",
            query, terms, queryWeights.keySet(), matches.lexical().size(), matches.overlap().size());

        if (!requested.usesSemantic()) {
            return new RankingResult(sorted(traditional.values()), SearchMode.TRADITIONAL, capability.available());
        }
        if (!capability.available()) {
            log.debug("Semantic ranking unavailable ({}), serving traditional results", capability.reason());
            return new RankingResult(sorted(traditional.values()), SearchMode.TRADITIONAL, false);
        }

        Optional<Map<Integer, Double>> similarities = similarities(query, matches.overlap());
        if (similarities.isEmpty()) {
            return new RankingResult(sorted(traditional.values()), SearchMode.TRADITIONAL, false);
        }

        List<RankedDocument> ranked = requested == SearchMode.SEMANTIC
            ? semantic(index, matches, similarities.get())
            : hybrid(index, matches, traditional, similarities.get(), pagerankWeight);
        return new RankingResult(sorted(ranked), requested, true);
    }

    private SortedMap<String, Double> queryWeights(List<String> terms, IndexSnapshot index) {
        SortedMap<String, Integer> counts = new TreeMap<>();
        for (String term : terms) {
            counts.merge(term, 1, Integer::sum);
        }

        SortedMap<String, Double> weights = new TreeMap<>();
        counts.forEach((term, qtf) -> {
            OptionalDouble idf = index.idf(term);
            if (idf.isPresent()) {
                weights.put(term, qtf * idf.getAsDouble());
            }
        });
        return weights;
    }

    private LexicalMatches match(IndexSnapshot index, SortedMap<String, Double> queryWeights) {
        double queryNorm = Math.sqrt(queryWeights.values().stream().mapToDouble(w -> w * w).sum());

        List<ShardMatches> perShard = index.shards().parallelStream()
            .map(shard -> matchShard(shard, queryWeights, queryNorm))
            .toList();

        SortedMap<Integer, Double> lexical = new TreeMap<>();
        SortedSet<Integer> overlap = new TreeSet<>();
        for (ShardMatches shardMatches : perShard) {
            lexical.putAll(shardMatches.lexical());
            overlap.addAll(shardMatches.overlap());
        }
        return new LexicalMatches(lexical, overlap);
    }

    private ShardMatches matchShard(InvertedIndexShard shard, SortedMap<String, Double> queryWeights, double queryNorm) {
        Map<Integer, Double> dot = new HashMap<>();
        Map<Integer, Integer> matchedTerms = new HashMap<>();

        for (Map.Entry<String, Double> queryTerm : queryWeights.entrySet()) {
            TermPostings postings = shard.postings(queryTerm.getKey());
            if (postings == null) {
                continue;
            }
            for (Posting posting : postings.postings()) {
                dot.merge(posting.docId(), queryTerm.getValue() * posting.weight(), Double::sum);
                matchedTerms.merge(posting.docId(), 1, Integer::sum);
            }
        }

        Map<Integer, Double> lexical = new HashMap<>();
        for (Map.Entry<Integer, Double> entry : dot.entrySet()) {
            int docId = entry.getKey();
            if (properties.requireAllTerms() && matchedTerms.get(docId) < queryWeights.size()) {
                continue;
            }
            double norm = shard.norm(docId);
            lexical.put(docId, norm == 0.0 || queryNorm == 0.0 ? 0.0 : entry.getValue() / (queryNorm * norm));
        }
        return new ShardMatches(lexical, dot.keySet());
    }

    private Map<Integer, RankedDocument> traditional(IndexSnapshot index, LexicalMatches matches, double w) {
        Map<Integer, RankedDocument> scored = new HashMap<>();
        matches.lexical().forEach((docId, lexical) -> {
            double pageRank = index.pageRank().score(docId);
            if (lexical == 0.0 && pageRank == 0.0) {
                return;
            }
            double score = (1 - w) * lexical + w * pageRank;
            scored.put(docId, new RankedDocument(docId, score, lexical, pageRank, 0.0));
        });
        return scored;
    }

    private List<RankedDocument> semantic(IndexSnapshot index, LexicalMatches matches, Map<Integer, Double> similarities) {
        List<RankedDocument> ranked = new ArrayList<>();
        similarities.forEach((docId, similarity) -> {
            if (similarity >= properties.minSemanticSimilarity()) {
                ranked.add(new RankedDocument(docId, similarity,
                    matches.lexical().getOrDefault(docId, 0.0), index.pageRank().score(docId), similarity));
            }
        });
        return ranked;
    }

    private List<RankedDocument> hybrid(
        IndexSnapshot index,
        LexicalMatches matches,
        Map<Integer, RankedDocument> traditional,
        Map<Integer, Double> similarities,
        double w
    ) {
        double alpha = properties.hybridSemanticWeight();
        SortedSet<Integer> candidates = new TreeSet<>(traditional.keySet());
        similarities.forEach((docId, similarity) -> {
            if (similarity >= properties.minSemanticSimilarity()) {
                candidates.add(docId);
            }
        });

        List<RankedDocument> ranked = new ArrayList<>(candidates.size());
        for (int docId : candidates) {
            double pageRank = index.pageRank().score(docId);
            RankedDocument lexicalHit = traditional.get(docId);
            double traditionalScore = lexicalHit != null ? lexicalHit.score() : w * pageRank;
            double similarity = similarities.getOrDefault(docId, 0.0);
            double semanticScore = similarity >= properties.minSemanticSimilarity() ? similarity : 0.0;

            double score = (1 - alpha) * traditionalScore + alpha * semanticScore;
            if (score > 0.0) {
                ranked.add(new RankedDocument(docId, score,
                    matches.lexical().getOrDefault(docId, 0.0), pageRank, semanticScore));
            }
        }
        return ranked;
    }

    /**
     * Runs the embedding lookups under the configured deadline. Empty means semantic ranking
     * could not be served for this query, including when none of the candidates has a cached vector.
     */
    private Optional<Map<Integer, Double>> similarities(String query, Set<Integer> overlap) {
        Future<Map<Integer, Double>> lookup;
        try {
            lookup = semanticExecutor.submit(() -> computeSimilarities(query, overlap));
        } catch (RejectedExecutionException e) {
            log.warn("Semantic executor saturated, serving traditional results");
            return Optional.empty();
        }

        Map<Integer, Double> similarities;
        try {
            similarities = lookup.get(properties.semanticTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            lookup.cancel(true);
            log.warn("Semantic lookup exceeded {} ms, serving traditional results",
                properties.semanticTimeout().toMillis());
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Semantic lookup failed, serving traditional results: {}", cause.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            lookup.cancel(true);
            Thread.currentThread().interrupt();
            return Optional.empty();
        }

        if (similarities.isEmpty()) {
            log.info("No embeddings cached for {} candidate(s), serving traditional results", overlap.size());
            return Optional.empty();
        }
        return Optional.of(similarities);
    }

    private Map<Integer, Double> computeSimilarities(String query, Set<Integer> overlap) {
        float[] queryVector = embeddingService.embedQuery(query);
        Map<Integer, Double> similarities = new TreeMap<>();

        boolean corpus = properties.semanticCandidates() == SemanticCandidatePolicy.CORPUS
            || (overlap.isEmpty() && properties.corpusFallback());
        if (corpus) {
            for (SimilarDocument neighbour : embeddingRepository.findNearest(queryVector, properties.corpusFallbackLimit())) {
                similarities.put(neighbour.docId(), Math.max(0.0, neighbour.similarity()));
            }
            return similarities;
        }

        embeddingRepository.findByDocIds(overlap)
            .forEach((docId, vector) -> similarities.put(docId, Math.max(0.0, cosine(queryVector, vector))));
        return similarities;
    }

    static double cosine(float[] a, float[] b) {
        if (a.length != b.length || a.length == 0) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static List<RankedDocument> sorted(Iterable<RankedDocument> documents) {
        List<RankedDocument> result = new ArrayList<>();
        documents.forEach(result::add);
        result.sort(RankedDocument.BY_SCORE);
        return result;
    }
}
