package com.hybridsearch.config;

import com.hybridsearch.model.SemanticCandidatePolicy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.ranking")
public record RankingProperties(
    @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.5") double defaultPagerankWeight,
    @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.5") double hybridSemanticWeight,
    @NotNull @DefaultValue("LEXICAL_OVERLAP") SemanticCandidatePolicy semanticCandidates,
    @DefaultValue("true") boolean corpusFallback,
    @Min(1) @DefaultValue("100") int corpusFallbackLimit,
    @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.1") double minSemanticSimilarity,
    @NotNull @DefaultValue("2s") Duration semanticTimeout,
    @DefaultValue("true") boolean requireAllTerms,
    @Min(1) @DefaultValue("10") int defaultLimit,
    @Min(1) @DefaultValue("100") int maxLimit
) {}
