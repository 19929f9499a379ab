package com.prism.documents.config;

import com.prism.documents.infra.HuggingFaceEmbeddingModel;
import com.prism.documents.infra.LinearBackOffPolicy;
import com.prism.documents.infra.RetryableFailurePolicy;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;

@Configuration
public class EmbeddingConfig {

    @Bean
    public EmbeddingModel embeddingModel(RestClient.Builder builder, EmbeddingProperties properties) {
        int timeoutMillis = (int) properties.timeout().toMillis();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);

        RestClient restClient = builder
            .baseUrl(properties.baseUrl())
            .requestFactory(requestFactory)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + (properties.isConfigured() ? properties.apiKey() : ""))
            .build();

        return new HuggingFaceEmbeddingModel(restClient, properties.model(), properties.dimension());
    }

    @Bean
    public Sleeper retrySleeper() {
        return new ThreadWaitSleeper();
    }

    @Bean
    public RetryTemplate embeddingRetryTemplate(EmbeddingProperties properties, Sleeper retrySleeper) {
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new RetryableFailurePolicy(properties.maxAttempts()));
        template.setBackOffPolicy(new LinearBackOffPolicy(properties.retryBaseDelay(), retrySleeper));
        return template;
    }
}
