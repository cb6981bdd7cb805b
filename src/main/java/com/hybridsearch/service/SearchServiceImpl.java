package com.hybridsearch.service;

import com.hybridsearch.config.RankingProperties;
import com.hybridsearch.controller.SearchHit;
import com.hybridsearch.controller.SearchResponse;
import com.hybridsearch.exception.WrongQueryException;
import com.hybridsearch.model.DocumentMetadata;
import com.hybridsearch.model.RankedDocument;
import com.hybridsearch.model.RankingResult;
import com.hybridsearch.model.SearchMode;
import com.hybridsearch.repository.DocumentMetadataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class SearchServiceImpl implements SearchService {

    private static final int MAX_QUERY_LENGTH = 1000;

    private final RankingEngine rankingEngine;
    private final DocumentMetadataRepository metadataRepository;
    private final SemanticCapabilityProvider capabilityProvider;
    private final RankingProperties properties;

    @Override
    public SearchResponse search(String query, Double pagerankWeight, String modeValue, Integer limit) {
        double weight = pagerankWeight == null ? properties.defaultPagerankWeight() : pagerankWeight;
        int maxHits = limit == null ? properties.defaultLimit() : limit;
        validate(query, weight, maxHits);

        SearchMode mode = SearchMode.fromValue(modeValue);
        if (query == null || query.isBlank()) {
            return new SearchResponse(List.of(), SearchMode.TRADITIONAL, capabilityProvider.current().available());
        }

        log.debug("Searching '{}' with w={}, mode={}, limit={}", query, weight, mode, maxHits);
        RankingResult result = rankingEngine.rank(query, weight, mode);

        List<RankedDocument> top = result.documents().stream().limit(maxHits).toList();
        Map<Integer, DocumentMetadata> metadata = decorate(top);

        List<SearchHit> hits = top.stream()
            .map(doc -> {
                DocumentMetadata meta = metadata.getOrDefault(doc.docId(), DocumentMetadata.blank(doc.docId()));
                return new SearchHit(doc.docId(), doc.score(), meta.title(), meta.url(), meta.summary());
            })
            .toList();

        return new SearchResponse(hits, result.searchMode(), result.semanticAvailable());
    }

    private Map<Integer, DocumentMetadata> decorate(List<RankedDocument> documents) {
        if (documents.isEmpty()) {
            return Map.of();
        }
        try {
            return metadataRepository.findByIds(documents.stream().map(RankedDocument::docId).toList());
        } catch (DataAccessException e) {
            log.warn("Metadata lookup failed, returning undecorated hits: {}", e.getMessage());
            return Map.of();
        }
    }

    private void validate(String query, double weight, int limit) {
        if (query != null && query.length() > MAX_QUERY_LENGTH) {
            throw new WrongQueryException("Query too long");
        }
        if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
            throw new WrongQueryException("Parameter 'w' must be between 0 and 1");
        }
        if (limit < 1 || limit > properties.maxLimit()) {
            throw new WrongQueryException("Parameter 'limit' must be between 1 and " + properties.maxLimit());
        }
    }
}
