package com.hybridsearch.model;

public record RawDocument(
    String source,
    int ordinal,
    String markup
) {}
