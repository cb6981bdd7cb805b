package com.hybridsearch.service;

import com.hybridsearch.config.EmbeddingProperties;
import com.hybridsearch.exception.EmbeddingException;
import com.hybridsearch.infra.RateLimiter;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

@Service
@Slf4j
public class EmbeddingServiceImpl implements EmbeddingService {

    public static final String EMBEDDING_LIMIT = "embedding_limit";

    private final ObjectProvider<EmbeddingModel> embeddingModel;
    private final RateLimiter embeddingLimiter;
    private final EmbeddingProperties properties;

    public EmbeddingServiceImpl(
        ObjectProvider<EmbeddingModel> embeddingModel,
        @Qualifier("embeddingLimiter") RateLimiter embeddingLimiter,
        EmbeddingProperties properties
    ) {
        this.embeddingModel = embeddingModel;
        this.embeddingLimiter = embeddingLimiter;
        this.properties = properties;
    }

    @Override
    public boolean isModelAvailable() {
        return embeddingModel.getIfAvailable() != null;
    }

    @Override
    public float[] embedQuery(String inputQuery) {
        if (inputQuery == null || inputQuery.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }

        String query = inputQuery.trim().toLowerCase(Locale.ROOT);
        if (query.length() > properties.maxQueryChars()) {
            query = query.substring(0, properties.maxQueryChars());
            log.warn("Query was truncated to {} characters for embedding", properties.maxQueryChars());
        }

        log.debug("Generating embedding for query: '{}'", query);

        try {
            float[] vector = requireModel().embed(query).content().vector();
            if (vector == null || vector.length == 0) {
                throw new IllegalStateException("Embedding model returned an empty vector for query: " + query);
            }
            return vector;
        } catch (Exception e) {
            log.error("Failed to generate embedding for query: {}", query, e);
            throw new EmbeddingException("Error during query vectorization", e);
        }
    }

    @Override
    @Retryable(
        retryFor = RuntimeException.class,
        noRetryFor = {IllegalArgumentException.class, EmbeddingException.class},
        maxAttempts = 3,
        backoff = @Backoff(delay = 500, multiplier = 2)
    )
    public List<float[]> embedDocuments(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        EmbeddingModel model = requireModel();

        int estimatedTokens = texts.stream().mapToInt(String::length).sum() / 4;
        Response<List<Embedding>> response = embeddingLimiter.execute(EMBEDDING_LIMIT, estimatedTokens,
            () -> model.embedAll(texts.stream().map(TextSegment::from).toList()));

        List<Embedding> embeddings = response.content();
        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new IllegalStateException("Embedding model returned "
                + (embeddings == null ? 0 : embeddings.size()) + " vectors for " + texts.size() + " texts");
        }
        return embeddings.stream().map(Embedding::vector).toList();
    }

    @Recover
    public List<float[]> recoverDocuments(RuntimeException e, List<String> texts) {
        log.error("Embedding batch of {} texts failed: {}", texts.size(), e.getMessage());
        throw new EmbeddingException("Embedding batch failed: " + e.getMessage(), e);
    }

    private EmbeddingModel requireModel() {
        EmbeddingModel model = embeddingModel.getIfAvailable();
        if (model == null) {
            throw new EmbeddingException("No embedding model is configured");
        }
        return model;
    }
}
