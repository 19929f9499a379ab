package com.prism.documents.model;

import java.util.UUID;

/**
 * A stored chunk loaded for scoring, joined with the name of its document.
 */
public record ChunkCandidate(
    UUID documentId,
    String documentName,
    int pageNumber,
    String content,
    float[] vector
) {}
