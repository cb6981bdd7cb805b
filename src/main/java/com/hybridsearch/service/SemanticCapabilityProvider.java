package com.hybridsearch.service;

import com.hybridsearch.model.SemanticCapability;
import com.hybridsearch.repository.DocumentEmbeddingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Decides once, and again after every embedding run, whether semantic ranking can be served.
 * Queries read the cached result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SemanticCapabilityProvider {

    private final EmbeddingService embeddingService;
    private final DocumentEmbeddingRepository embeddingRepository;

    private volatile SemanticCapability capability = SemanticCapability.unavailable("not initialized");

    public SemanticCapability current() {
        return capability;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initialize() {
        refresh();
    }

    public SemanticCapability refresh() {
        SemanticCapability next = evaluate();
        if (next.available() != capability.available()) {
            log.info("Semantic search {}: {}", next.available() ? "enabled" : "disabled", next.reason());
        }
        capability = next;
        return next;
    }

    private SemanticCapability evaluate() {
        if (!embeddingService.isModelAvailable()) {
            return SemanticCapability.unavailable("no embedding model configured");
        }
        try {
            long cached = embeddingRepository.count();
            if (cached == 0) {
                return SemanticCapability.unavailable("embedding cache is empty");
            }
            return SemanticCapability.ready();
        } catch (DataAccessException e) {
            log.warn("Embedding cache is unreachable: {}", e.getMessage());
            return SemanticCapability.unavailable("embedding cache unreachable");
        }
    }
}
