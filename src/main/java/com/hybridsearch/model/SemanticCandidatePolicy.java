package com.hybridsearch.model;

/**
 * Which documents are compared against the query embedding.
 */
public enum SemanticCandidatePolicy {
    /** Documents sharing at least one query term with the query. */
    LEXICAL_OVERLAP,
    /** Nearest neighbours over the whole embedding cache. */
    CORPUS
}
