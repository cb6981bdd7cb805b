package com.hybridsearch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SearchMode {
    TRADITIONAL,
    SEMANTIC,
    HYBRID;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean usesSemantic() {
        return this != TRADITIONAL;
    }

    /**
     * Unknown or missing values resolve to {@link #TRADITIONAL}.
     */
    public static SearchMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return TRADITIONAL;
        }
        for (SearchMode mode : values()) {
            if (mode.value().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return mode;
            }
        }
        return TRADITIONAL;
    }
}
