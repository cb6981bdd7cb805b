package com.hybridsearch.model;

public record DocumentCount(long value) {
    public DocumentCount {
        if (value < 0) {
            throw new IllegalArgumentException("Document count cannot be negative: " + value);
        }
    }
}
