package com.hybridsearch.repository;

import com.hybridsearch.model.DocumentMetadata;

import java.util.Collection;
import java.util.Map;

public interface DocumentMetadataRepository {
    Map<Integer, DocumentMetadata> findByIds(Collection<Integer> docIds);
}
