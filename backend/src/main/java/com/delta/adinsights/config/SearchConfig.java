package com.delta.adinsights.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SearchConfig {

    /**
     * Unbounded so that every per-domain provider call of a search starts immediately,
     * never queued behind another domain's call.
     */
    @Bean(name = "fanOutExecutor", destroyMethod = "shutdown")
    public ExecutorService fanOutExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(SearchProperties properties) {
        return Executors.newFixedThreadPool(properties.getHttpThreads());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
