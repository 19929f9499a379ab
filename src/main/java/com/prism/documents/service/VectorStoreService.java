package com.prism.documents.service;

import com.prism.documents.model.RankedChunk;
import com.prism.documents.model.SearchOptions;
import com.prism.documents.model.TextChunk;

import java.util.List;
import java.util.UUID;

public interface VectorStoreService {
    int index(UUID userId, UUID documentId, List<TextChunk> chunks);
    List<RankedChunk> search(UUID userId, String query, SearchOptions options);
    int deleteDocumentEmbeddings(UUID documentId);
    int countDocumentEmbeddings(UUID documentId);
}
