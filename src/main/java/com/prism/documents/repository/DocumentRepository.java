package com.prism.documents.repository;

import com.prism.documents.model.Document;
import com.prism.documents.model.ExtractionResult;
import com.prism.documents.model.ProcessingStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lifecycle updates return {@code false} when no row matched: the document is
 * gone or not in the expected state.
 */
public interface DocumentRepository {
    Document save(Document document);
    Optional<Document> findById(UUID id);
    Optional<Document> findByIdAndUser(UUID id, UUID userId);
    List<Document> listByUser(UUID userId, int limit, int offset);
    long countByUser(UUID userId);
    boolean claimForProcessing(UUID id);
    boolean markFailed(UUID id, String error);
    boolean markCompleted(UUID id, ExtractionResult extraction, int imageCount);
    boolean updateEmbeddingStatus(UUID id, ProcessingStatus status);
    boolean resetForReprocess(UUID id, UUID userId);
    List<UUID> failStaleProcessing(int staleMinutes, String error);
    List<UUID> failStaleEmbedding(int staleMinutes);
    boolean delete(UUID id, UUID userId);
}
