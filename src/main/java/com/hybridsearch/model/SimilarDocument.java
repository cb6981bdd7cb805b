package com.hybridsearch.model;

public record SimilarDocument(int docId, double similarity) {}
