package com.hybridsearch.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;

import java.time.Duration;

/**
 * The embedding model exists only when an API key is configured. Without it the service runs
 * in traditional mode and reports semantic search as unavailable.
 */
@Slf4j
@Configuration
public class LangChainConfig {

    @Value("${app.gemini.api-key:}")
    private String apiKey;

    @Value("${app.gemini.embedding-model:gemini-embedding-001}")
    private String modelName;

    @Bean
    @ConditionalOnExpression("!'${app.gemini.api-key:}'.isBlank()")
    public EmbeddingModel embeddingModel(EmbeddingProperties properties) {
        log.info("Configuring embedding model {} with dimension {}", modelName, properties.dimension());
        return GoogleAiEmbeddingModel.builder()
            .apiKey(apiKey)
            .modelName(modelName)
            .outputDimensionality(properties.dimension())
            .timeout(Duration.ofSeconds(30))
            .maxRetries(2)
            .build();
    }
}
