package com.prism.documents.service;

import com.prism.documents.config.EmbeddingProperties;
import com.prism.documents.exception.DimensionMismatchException;
import com.prism.documents.exception.EmbeddingProviderException;
import com.prism.documents.infra.RateLimiter;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class EmbeddingServiceImpl implements EmbeddingService {

    public static final String EMBEDDING_LIMIT = "embedding_limit";

    private final EmbeddingModel embeddingModel;
    private final RateLimiter embeddingLimiter;
    private final RetryTemplate retryTemplate;
    private final Sleeper sleeper;
    private final EmbeddingProperties properties;

    public EmbeddingServiceImpl(
        EmbeddingModel embeddingModel,
        @Qualifier("embeddingLimiter") RateLimiter embeddingLimiter,
        RetryTemplate retryTemplate,
        Sleeper sleeper,
        EmbeddingProperties properties
    ) {
        this.embeddingModel = embeddingModel;
        this.embeddingLimiter = embeddingLimiter;
        this.retryTemplate = retryTemplate;
        this.sleeper = sleeper;
        this.properties = properties;
    }

    @Override
    public boolean isConfigured() {
        return properties.isConfigured();
    }

    @Override
    public int dimension() {
        return properties.dimension();
    }

    @Override
    public float[] embed(String text) {
        String input = prepare(text);
        requireConfigured();

        log.debug("Generating embedding for {} characters", input.length());
        Embedding embedding = embeddingLimiter.execute(EMBEDDING_LIMIT, input.length(),
            () -> retryTemplate.execute(context -> embeddingModel.embed(input).content()));

        return checkDimension(embedding);
    }

    /**
     * Order-preserving: the i-th vector belongs to the i-th text. Sub-batches are
     * bounded by {@code max-batch-size} and separated by {@code batch-delay}.
     */
    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<String> inputs = texts.stream().map(this::prepare).toList();
        requireConfigured();

        int batchSize = properties.maxBatchSize();
        List<float[]> vectors = new ArrayList<>(inputs.size());

        for (int from = 0; from < inputs.size(); from += batchSize) {
            if (from > 0) {
                pauseBetweenBatches();
            }
            List<TextSegment> segments = inputs.subList(from, Math.min(from + batchSize, inputs.size()))
                .stream()
                .map(TextSegment::from)
                .toList();
            int characters = segments.stream().mapToInt(segment -> segment.text().length()).sum();

            List<Embedding> embeddings = embeddingLimiter.execute(EMBEDDING_LIMIT, characters,
                () -> retryTemplate.execute(context -> embeddingModel.embedAll(segments).content()));

            if (embeddings == null || embeddings.size() != segments.size()) {
                throw new EmbeddingProviderException(
                    "Expected " + segments.size() + " embeddings, got " + (embeddings == null ? 0 : embeddings.size()),
                    false);
            }
            embeddings.forEach(embedding -> vectors.add(checkDimension(embedding)));

            log.debug("Embedding batch progress: {}/{}", vectors.size(), inputs.size());
        }
        return vectors;
    }

    private String prepare(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed empty text");
        }
        String trimmed = text.trim();
        return trimmed.length() > properties.maxInputChars()
            ? trimmed.substring(0, properties.maxInputChars())
            : trimmed;
    }

    private void requireConfigured() {
        if (!isConfigured()) {
            throw new EmbeddingProviderException("Embedding provider is not configured", false);
        }
    }

    private float[] checkDimension(Embedding embedding) {
        float[] vector = embedding == null ? null : embedding.vector();
        int actual = vector == null ? 0 : vector.length;
        if (actual != properties.dimension()) {
            throw new DimensionMismatchException(properties.dimension(), actual);
        }
        return vector;
    }

    private void pauseBetweenBatches() {
        try {
            sleeper.sleep(properties.batchDelay().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingProviderException("Interrupted between embedding batches", e);
        }
    }
}
