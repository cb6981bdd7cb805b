package com.hybridsearch.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.tokenizer")
public record TokenizerProperties(
    @NotBlank @DefaultValue("classpath:stopwords.txt") String stopwords,
    @DefaultValue("false") boolean stemming
) {}
