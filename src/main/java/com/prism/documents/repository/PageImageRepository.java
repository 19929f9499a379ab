package com.prism.documents.repository;

import com.prism.documents.model.PageImage;

import java.util.List;
import java.util.UUID;

public interface PageImageRepository {
    void saveAll(UUID documentId, List<PageImage> images);
    List<PageImage> findByDocumentId(UUID documentId);
    int deleteByDocumentId(UUID documentId);
}
