package com.prism.documents.service;

import com.prism.documents.exception.DimensionMismatchException;
import com.prism.documents.model.ChunkCandidate;
import com.prism.documents.model.ChunkEmbedding;
import com.prism.documents.model.RankedChunk;
import com.prism.documents.model.SearchOptions;
import com.prism.documents.model.TextChunk;
import com.prism.documents.repository.DocumentChunkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Exact cosine scan over a user's chunks. Suited to a few thousand chunks
 * per user; there is no approximate index behind it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VectorStoreServiceImpl implements VectorStoreService {

    private final DocumentChunkRepository chunkRepository;
    private final EmbeddingService embeddingService;

    @Override
    public int index(UUID userId, UUID documentId, List<TextChunk> chunks) {
        int removed = chunkRepository.deleteByDocumentId(documentId);
        if (removed > 0) {
            log.info("Doc {}: removed {} previous chunk embeddings", documentId, removed);
        }
        if (chunks.isEmpty()) {
            return 0;
        }

        List<float[]> vectors = embeddingService.embedBatch(chunks.stream().map(TextChunk::text).toList());

        int dimension = embeddingService.dimension();
        List<ChunkEmbedding> records = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            TextChunk chunk = chunks.get(i);
            float[] vector = vectors.get(i);
            if (vector.length != dimension) {
                throw new DimensionMismatchException(dimension, vector.length);
            }
            records.add(new ChunkEmbedding(
                null, documentId, userId, chunk.chunkIndex(), chunk.pageNumber(), chunk.text(), vector, null));
        }

        chunkRepository.insertAll(records);
        log.info("Doc {}: indexed {} chunks", documentId, records.size());
        return records.size();
    }

    @Override
    public List<RankedChunk> search(UUID userId, String query, SearchOptions options) {
        if (query == null || query.isBlank()) {
            return List.of();
        }

        float[] queryVector;
        List<ChunkCandidate> candidates;
        try {
            queryVector = embeddingService.embed(query);
            candidates = chunkRepository.findCandidates(userId, options.documentId());
        } catch (RuntimeException e) {
            log.warn("Search degraded to empty result for user {}: {}", userId, e.getMessage());
            return List.of();
        }

        List<RankedChunk> matches = new ArrayList<>();
        int skipped = 0;
        for (ChunkCandidate candidate : candidates) {
            if (candidate.vector() == null || candidate.vector().length != queryVector.length) {
                skipped++;
                continue;
            }
            double score = CosineSimilarity.similarity(queryVector, candidate.vector());
            if (score >= options.minScore()) {
                matches.add(new RankedChunk(
                    candidate.content(), candidate.documentId(), candidate.documentName(), candidate.pageNumber(), score));
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} stored vectors with unexpected dimension for user {}", skipped, userId);
        }

        log.debug("Scored {} candidates, {} above {}", candidates.size() - skipped, matches.size(), options.minScore());
        return matches.stream()
            .sorted(Comparator.comparingDouble(RankedChunk::score).reversed())
            .limit(options.topK())
            .toList();
    }

    @Override
    public int deleteDocumentEmbeddings(UUID documentId) {
        return chunkRepository.deleteByDocumentId(documentId);
    }

    @Override
    public int countDocumentEmbeddings(UUID documentId) {
        try {
            return chunkRepository.countByDocumentId(documentId);
        } catch (DataAccessException e) {
            log.warn("Doc {}: could not count embeddings: {}", documentId, e.getMessage());
            return 0;
        }
    }
}
