package com.prism.documents.service;

import com.prism.documents.controller.DocumentListResponse;
import com.prism.documents.controller.DocumentResponse;
import com.prism.documents.model.PageImage;
import com.prism.documents.model.RankedChunk;
import com.prism.documents.model.SearchOptions;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;

public interface DocumentService {
    DocumentResponse upload(MultipartFile file, UUID userId);
    DocumentResponse getDocument(UUID documentId, UUID userId);
    DocumentListResponse listDocuments(UUID userId, int page, int size);
    void deleteDocument(UUID documentId, UUID userId);
    List<PageImage> getDocumentImages(UUID documentId);
    List<PageImage> getDocumentImages(UUID documentId, UUID userId);
    DocumentResponse reprocessDocument(UUID documentId, UUID userId);
    List<RankedChunk> searchDocuments(UUID userId, String query, SearchOptions options);
}
