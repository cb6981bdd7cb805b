package com.hybridsearch.repository;

import com.hybridsearch.model.DocumentMetadata;
import com.hybridsearch.model.SimilarDocument;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface DocumentEmbeddingRepository {
    long count();
    Map<Integer, float[]> findByDocIds(Collection<Integer> docIds);
    List<SimilarDocument> findNearest(float[] vector, int limit);
    void saveAll(Map<Integer, float[]> embeddings);
    List<DocumentMetadata> findDocumentsWithoutEmbedding(int afterDocId, int limit);
}
