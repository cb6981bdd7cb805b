package com.hybridsearch.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

@Validated
@ConfigurationProperties(prefix = "app.index")
public record IndexProperties(
    @NotNull Path directory,
    @Min(1) @Max(1024) @DefaultValue("3") int shards,
    @NotNull Path pagerankFile,
    @Min(1) @DefaultValue("2") int retainedVersions
) {}
