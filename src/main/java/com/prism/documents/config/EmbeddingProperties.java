package com.prism.documents.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Embedding provider settings. An empty {@code apiKey} means no provider is
 * configured and documents are completed without a search index.
 */
@Validated
@ConfigurationProperties(prefix = "app.embedding")
public record EmbeddingProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Min(1) int dimension,
    @Min(1) int maxBatchSize,
    @NotNull Duration batchDelay,
    @Min(1) int maxAttempts,
    @NotNull Duration retryBaseDelay,
    @NotNull Duration timeout,
    @Min(1) int maxInputChars,
    @Min(1) int requestsPerMinute,
    @Min(1) int charsPerMinute
) {

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
