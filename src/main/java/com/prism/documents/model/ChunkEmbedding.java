package com.prism.documents.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ChunkEmbedding(
    UUID id,
    UUID documentId,
    UUID userId,
    int chunkIndex,
    int pageNumber,
    String content,
    float[] vector,
    OffsetDateTime createdAt
) {}
