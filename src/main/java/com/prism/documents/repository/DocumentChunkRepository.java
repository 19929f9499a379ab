package com.prism.documents.repository;

import com.prism.documents.model.ChunkCandidate;
import com.prism.documents.model.ChunkEmbedding;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DocumentChunkRepository {
    int deleteByDocumentId(UUID documentId);
    void insertAll(List<ChunkEmbedding> chunks);
    List<ChunkCandidate> findCandidates(UUID userId, Optional<UUID> documentId);
    int countByDocumentId(UUID documentId);
}
