package com.hybridsearch.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.embeddings")
public record EmbeddingProperties(
    @Min(1) @Max(4096) @DefaultValue("768") int dimension,
    @Min(1) @Max(1000) @DefaultValue("32") int batchSize,
    @Min(1) @DefaultValue("60") int requestsPerMinute,
    @Min(1) @DefaultValue("500000") int tokensPerMinute,
    @Min(1) @DefaultValue("1000") int maxQueryChars
) {}
