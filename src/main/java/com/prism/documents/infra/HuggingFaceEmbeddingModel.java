package com.prism.documents.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.prism.documents.exception.EmbeddingProviderException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * {@link EmbeddingModel} backed by the Hugging Face feature-extraction pipeline.
 * One HTTP call per {@link #embedAll(List)}; retries are left to the caller.
 */
@Slf4j
public class HuggingFaceEmbeddingModel implements EmbeddingModel {

    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(429, 503, 504);

    private final RestClient restClient;
    private final String model;
    private final int dimension;

    public HuggingFaceEmbeddingModel(RestClient restClient, String model, int dimension) {
        this.restClient = restClient;
        this.model = model;
        this.dimension = dimension;
    }

    @Override
    public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
        if (segments.isEmpty()) {
            return Response.from(List.of());
        }

        List<String> inputs = segments.stream().map(TextSegment::text).toList();
        JsonNode body;
        try {
            body = restClient.post()
                .uri("/" + model + "/pipeline/feature-extraction")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("inputs", inputs))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    int status = response.getStatusCode().value();
                    String payload = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    throw new EmbeddingProviderException(
                        "Embedding provider returned " + status + ": " + payload,
                        isTransient(status, payload),
                        status,
                        null
                    );
                })
                .body(JsonNode.class);
        } catch (ResourceAccessException e) {
            throw new EmbeddingProviderException("Embedding provider unreachable: " + e.getMessage(), true, null, e);
        }

        List<Embedding> embeddings = parse(body);
        if (embeddings.size() != inputs.size()) {
            throw new EmbeddingProviderException(
                "Embedding provider returned " + embeddings.size() + " vectors for " + inputs.size() + " inputs", false);
        }
        log.debug("Embedded {} segments with {}", inputs.size(), model);
        return Response.from(embeddings);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    static boolean isTransient(int status, String payload) {
        if (TRANSIENT_STATUSES.contains(status)) {
            return true;
        }
        String lower = payload == null ? "" : payload.toLowerCase(Locale.ROOT);
        return lower.contains("loading") || lower.contains("rate limit");
    }

    /**
     * Accepts {@code [v...]}, {@code [[v...], ...]} and the per-input nested
     * form {@code [[[v...]], ...]}. Token-level output is rejected.
     */
    static List<Embedding> parse(JsonNode body) {
        if (body == null || !body.isArray() || body.isEmpty()) {
            throw new EmbeddingProviderException("Embedding provider returned an empty response", false);
        }
        if (body.get(0).isNumber()) {
            return List.of(toEmbedding(body));
        }

        List<Embedding> embeddings = new ArrayList<>(body.size());
        for (JsonNode item : body) {
            embeddings.add(toEmbedding(flatten(item)));
        }
        return embeddings;
    }

    private static JsonNode flatten(JsonNode item) {
        JsonNode current = item;
        while (current.isArray() && !current.isEmpty() && current.get(0).isArray()) {
            if (current.size() != 1) {
                throw new EmbeddingProviderException(
                    "Embedding provider returned token-level output; a pooled sentence model is required", false);
            }
            current = current.get(0);
        }
        return current;
    }

    private static Embedding toEmbedding(JsonNode vector) {
        if (!vector.isArray()) {
            throw new EmbeddingProviderException("Embedding provider returned a non-array vector", false);
        }
        float[] values = new float[vector.size()];
        for (int i = 0; i < values.length; i++) {
            JsonNode value = vector.get(i);
            if (!value.isNumber()) {
                throw new EmbeddingProviderException("Embedding provider returned a non-numeric component", false);
            }
            values[i] = value.floatValue();
        }
        return Embedding.from(values);
    }
}
