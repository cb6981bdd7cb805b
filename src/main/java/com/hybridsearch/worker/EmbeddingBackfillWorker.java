package com.hybridsearch.worker;

import com.hybridsearch.service.EmbeddingIndexer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Retries documents whose embedding batch failed or whose metadata arrived after the last
 * publish.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EmbeddingBackfillWorker {

    private final EmbeddingIndexer embeddingIndexer;

    @Scheduled(
        initialDelayString = "${app.embeddings.backfill-interval-ms:600000}",
        fixedDelayString = "${app.embeddings.backfill-interval-ms:600000}"
    )
    public void backfill() {
        int embedded = embeddingIndexer.indexMissing();
        if (embedded > 0) {
            log.info("Backfill embedded {} documents", embedded);
        }
    }
}
