package com.prism.documents.model;

/**
 * Shared by both lifecycle axes of a document: the coarse processing status
 * and the embedding (search indexing) status.
 */
public enum ProcessingStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
