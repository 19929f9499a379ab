package com.prism.documents.model;

import java.util.Optional;
import java.util.UUID;

public record SearchOptions(
    int topK,
    Optional<UUID> documentId,
    double minScore
) {

    public SearchOptions {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be positive: " + topK);
        }
        documentId = documentId == null ? Optional.empty() : documentId;
    }

    public static SearchOptions of(int topK, double minScore) {
        return new SearchOptions(topK, Optional.empty(), minScore);
    }

    public SearchOptions withDocument(UUID docId) {
        return new SearchOptions(topK, Optional.ofNullable(docId), minScore);
    }
}
