package com.hybridsearch.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public record PipelineProperties(
    @NotNull Path crawlDirectory,
    @NotNull Path workDirectory,
    @Min(1) @Max(256) @DefaultValue("4") int workers,
    @NotBlank @DefaultValue("docid") String docidAttribute,
    @DefaultValue("false") boolean keepWorkFiles
) {}
