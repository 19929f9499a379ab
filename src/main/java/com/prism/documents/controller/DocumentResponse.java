package com.prism.documents.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.prism.documents.model.Document;
import com.prism.documents.model.ProcessingStatus;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentResponse(
    UUID id,

    @JsonProperty("original_name")
    String originalName,

    @JsonProperty("file_size")
    long fileSize,

    ProcessingStatus status,

    @JsonProperty("embedding_status")
    ProcessingStatus embeddingStatus,

    @JsonProperty("search_available")
    boolean searchAvailable,

    @JsonProperty("page_count")
    int pageCount,

    @JsonProperty("image_count")
    int imageCount,

    @JsonProperty("module_tag")
    String moduleTag,

    List<String> tcodes,

    @JsonProperty("error_codes")
    List<String> errorCodes,

    @JsonProperty("reference_number")
    String referenceNumber,

    @JsonProperty("processing_error")
    String processingError,

    @JsonProperty("embedding_count")
    Integer embeddingCount,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt
) {

    public static DocumentResponse from(Document doc, Integer embeddingCount) {
        return new DocumentResponse(
            doc.id(),
            doc.originalName(),
            doc.fileSize(),
            doc.status(),
            doc.embeddingStatus(),
            doc.isSearchAvailable(),
            doc.pageCount(),
            doc.imageCount(),
            doc.moduleTag(),
            doc.tcodes(),
            doc.errorCodes(),
            doc.referenceNumber(),
            doc.processingError(),
            embeddingCount,
            doc.createdAt(),
            doc.updatedAt()
        );
    }
}
