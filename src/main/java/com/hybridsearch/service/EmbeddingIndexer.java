package com.hybridsearch.service;

import com.hybridsearch.config.EmbeddingProperties;
import com.hybridsearch.exception.EmbeddingException;
import com.hybridsearch.model.DocumentMetadata;
import com.hybridsearch.repository.DocumentEmbeddingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills the embedding cache for documents that have metadata but no vector yet. Each document
 * is embedded from its title and summary. A failed batch is left for the next run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingIndexer {

    private final EmbeddingService embeddingService;
    private final DocumentEmbeddingRepository embeddingRepository;
    private final SemanticCapabilityProvider capabilityProvider;
    private final EmbeddingProperties properties;

    public synchronized int indexMissing() {
        if (!embeddingService.isModelAvailable()) {
            log.debug("No embedding model configured, skipping embedding indexing");
            return 0;
        }

        int embedded = 0;
        int failedBatches = 0;
        int cursor = Integer.MIN_VALUE;

        while (true) {
            List<DocumentMetadata> batch =
                embeddingRepository.findDocumentsWithoutEmbedding(cursor, properties.batchSize());
            if (batch.isEmpty()) {
                break;
            }
            cursor = batch.get(batch.size() - 1).docId();

            Map<Integer, String> texts = new LinkedHashMap<>();
            for (DocumentMetadata document : batch) {
                String text = document.embeddingText();
                if (!text.isBlank()) {
                    texts.put(document.docId(), text);
                }
            }
            if (texts.isEmpty()) {
                continue;
            }

            try {
                List<float[]> vectors = embeddingService.embedDocuments(List.copyOf(texts.values()));
                Map<Integer, float[]> embeddings = new LinkedHashMap<>();
                int i = 0;
                for (Integer docId : texts.keySet()) {
                    embeddings.put(docId, vectors.get(i++));
                }
                embeddingRepository.saveAll(embeddings);
                embedded += embeddings.size();
            } catch (EmbeddingException e) {
                failedBatches++;
                log.error("Embedding batch ending at doc {} failed: {}", cursor, e.getMessage());
            }
        }

        log.info("Embedded {} documents ({} failed batches)", embedded, failedBatches);
        capabilityProvider.refresh();
        return embedded;
    }
}
