package com.prism.documents.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record Document(
    UUID id,
    UUID userId,
    String originalName,
    String storagePath,
    long fileSize,
    ProcessingStatus status,
    ProcessingStatus embeddingStatus,
    String textContent,
    int pageCount,
    int imageCount,
    String moduleTag,
    List<String> tcodes,
    List<String> errorCodes,
    String referenceNumber,
    String processingError,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {

    public static Document pending(UUID userId, String originalName, String storagePath, long fileSize) {
        return new Document(
            null,
            userId,
            originalName,
            storagePath,
            fileSize,
            ProcessingStatus.PENDING,
            ProcessingStatus.PENDING,
            null,
            0,
            0,
            null,
            List.of(),
            List.of(),
            null,
            null,
            null,
            null
        );
    }

    public boolean isSearchAvailable() {
        return status == ProcessingStatus.COMPLETED && embeddingStatus == ProcessingStatus.COMPLETED;
    }
}
