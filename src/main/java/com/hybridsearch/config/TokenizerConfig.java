package com.hybridsearch.config;

import com.hybridsearch.text.Tokenizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

@Slf4j
@Configuration
public class TokenizerConfig {

    @Bean
    public Tokenizer tokenizer(TokenizerProperties properties, ResourceLoader resourceLoader) throws IOException {
        Resource resource = resourceLoader.getResource(properties.stopwords());
        try (InputStream in = resource.getInputStream()) {
            Set<String> stopWords = Tokenizer.readStopWords(in);
            log.info("Loaded {} stop words from {}, stemming={}", stopWords.size(), properties.stopwords(), properties.stemming());
            return new Tokenizer(stopWords, properties.stemming());
        }
    }
}
