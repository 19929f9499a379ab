package com.prism.documents.config;

import com.prism.documents.infra.InMemoryDualRateLimiter;
import com.prism.documents.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("embeddingLimiter")
    public RateLimiter embeddingLimiter(EmbeddingProperties properties) {
        return new InMemoryDualRateLimiter(properties.requestsPerMinute(), properties.charsPerMinute());
    }
}
