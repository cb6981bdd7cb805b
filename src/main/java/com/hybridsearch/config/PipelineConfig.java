package com.hybridsearch.config;

import com.hybridsearch.pipeline.MapReduceExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;

@Configuration
public class PipelineConfig {

    @Bean
    public MapReduceExecutor mapReduceExecutor(
        @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor,
        PipelineProperties properties
    ) {
        return new MapReduceExecutor(pipelineExecutor, properties.workers());
    }
}
