package com.hybridsearch.listener;

import com.hybridsearch.event.IndexPublishedEvent;
import com.hybridsearch.index.IndexHolder;
import com.hybridsearch.service.EmbeddingIndexer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class IndexEventListener {

    private final IndexHolder indexHolder;
    private final EmbeddingIndexer embeddingIndexer;

    @EventListener
    public void handlePublished(IndexPublishedEvent event) {
        log.info("Index version {} published, swapping it in", event.version());
        indexHolder.reload();
    }

    @Async("embeddingTaskExecutor")
    @EventListener
    public void handleEmbeddingTask(IndexPublishedEvent event) {
        log.info("Starting async embedding indexing for version {}", event.version());
        embeddingIndexer.indexMissing();
    }
}
