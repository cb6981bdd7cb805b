package com.hybridsearch.service;

import java.util.List;

public interface EmbeddingService {
    boolean isModelAvailable();
    float[] embedQuery(String query);
    List<float[]> embedDocuments(List<String> texts);
}
