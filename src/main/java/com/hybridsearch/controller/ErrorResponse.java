package com.hybridsearch.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}
