package com.hybridsearch.config;

import com.hybridsearch.infra.InMemoryDualRateLimiter;
import com.hybridsearch.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("embeddingLimiter")
    public RateLimiter embeddingLimiter(EmbeddingProperties properties) {
        return new InMemoryDualRateLimiter(properties.requestsPerMinute(), properties.tokensPerMinute());
    }
}
