package com.hybridsearch.event;

public record IndexPublishedEvent(String version) {}
